package com.researchplatform.common.store;

import com.researchplatform.common.model.Alert;

/**
 * Append-only destination for monitor alerts.
 */
public interface AlertSink {

    void append(Alert alert);
}
