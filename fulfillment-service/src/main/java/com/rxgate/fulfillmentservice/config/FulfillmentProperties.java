package com.rxgate.fulfillmentservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "fulfillment")
public class FulfillmentProperties {

    private final Contact contact = new Contact();
    private final Prescription prescription = new Prescription();
    private final Notification notification = new Notification();
    private final Cleanup cleanup = new Cleanup();
    private final Security security = new Security();

    @Getter
    @Setter
    public static class Contact {
        private ContactMode mode = ContactMode.REQUIRED;
        // calling code without the leading '+'
        private String countryCode = "234";
    }

    @Getter
    @Setter
    public static class Prescription {
        private RejectionPolicy rejectionPolicy = RejectionPolicy.CANCEL;
    }

    @Getter
    @Setter
    public static class Notification {
        private Duration awaitTimeout = Duration.ofSeconds(10);
        private int corePoolSize = 4;
        private int maxPoolSize = 8;
        private int queueCapacity = 200;
    }

    @Getter
    @Setter
    public static class Cleanup {
        // read by the @Scheduled placeholder in StalePrescriptionOrderJob
        private String cron = "0 0 0 * * *";
        private Duration prescriptionTimeout = Duration.ofHours(48);
    }

    @Getter
    @Setter
    public static class Security {
        // OAuth2 client whose resource_access roles are checked
        private String clientId = "rxgate-backend";
    }
}
