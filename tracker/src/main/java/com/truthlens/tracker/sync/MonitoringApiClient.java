package com.truthlens.tracker.sync;

/**
 * Client of the Session API ({@code /api/content-monitoring/session/*}).
 */
public interface MonitoringApiClient {

    void startSession();

    /**
     * @throws SyncException when the server did not accept the record
     */
    void updateSession(ConsumptionDraft draft);

    void endSession();
}
