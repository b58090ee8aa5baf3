package com.rxgate.fulfillmentservice.notification;

import com.rxgate.common.contracts.PrescriptionDecisionContract;

/**
 * Hands a prescription decision to whatever delivers email/SMS to the patient.
 */
public interface NotificationDispatcher {

    void notify(PrescriptionDecisionContract contract) throws NotificationException;
}
