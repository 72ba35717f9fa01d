package com.researchplatform.common.store;

import com.researchplatform.common.model.Alert;

import java.util.List;

/**
 * Bounded alert history, newest first.
 */
public interface AlertLog extends AlertSink {

    List<Alert> recent(int limit);
}
