package com.ambr.core.report;

import java.io.IOException;

/**
 * Fire-and-forget operational notification of the run summary.
 */
public interface Notifier {

    void send(String title, String summary) throws IOException, InterruptedException;
}
