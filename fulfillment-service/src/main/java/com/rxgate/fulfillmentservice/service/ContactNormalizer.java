package com.rxgate.fulfillmentservice.service;

import com.rxgate.fulfillmentservice.config.ContactMode;
import com.rxgate.fulfillmentservice.config.FulfillmentProperties;
import com.rxgate.fulfillmentservice.exception.InvalidContactException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Canonicalizes patient phone numbers to international form and validates
 * phone/email before they are stored on a prescription.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContactNormalizer {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern NON_DIAL_CHARS = Pattern.compile("[^+\\d]");

    private final FulfillmentProperties properties;

    /**
     * Strips formatting and rewrites local numbers: "0803 123 4567" becomes
     * "+2348031234567", "2348031234567" gains its '+'. Returns null for null input.
     */
    public String normalizePhone(String raw) {
        if (raw == null) {
            return null;
        }
        String countryCode = properties.getContact().getCountryCode();
        String phone = NON_DIAL_CHARS.matcher(raw).replaceAll("");

        if (phone.startsWith("0")) {
            phone = "+" + countryCode + phone.substring(1);
        } else if (phone.startsWith(countryCode)) {
            phone = "+" + phone;
        }
        return phone;
    }

    public boolean isValidPhone(String raw) {
        String phone = normalizePhone(raw);
        if (phone == null) {
            return false;
        }
        return phone.matches("^\\+" + Pattern.quote(properties.getContact().getCountryCode()) + "\\d{10}$");
    }

    public boolean isValidEmail(String raw) {
        return raw != null && EMAIL.matcher(raw.trim()).matches();
    }

    /**
     * Normalizes the pair according to the configured {@link ContactMode}.
     *
     * @throws InvalidContactException in REQUIRED mode when neither value is usable
     */
    public ContactDetails normalize(String rawPhone, String rawEmail) {
        String phone = isBlank(rawPhone) ? null : rawPhone;
        String email = isBlank(rawEmail) ? null : rawEmail.trim();

        String validPhone = null;
        if (phone != null) {
            if (isValidPhone(phone)) {
                validPhone = normalizePhone(phone);
            } else {
                log.warn("Dropping invalid phone number: raw={}", phone);
            }
        }

        String validEmail = null;
        if (email != null) {
            if (isValidEmail(email)) {
                validEmail = email;
            } else {
                log.warn("Dropping invalid email address: raw={}", email);
            }
        }

        if (properties.getContact().getMode() == ContactMode.REQUIRED && validPhone == null && validEmail == null) {
            if (phone == null && email == null) {
                throw new InvalidContactException("Either phone or email is required");
            }
            throw new InvalidContactException("Please provide a valid phone number or email address");
        }

        return new ContactDetails(validPhone, validEmail);
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
