package com.dds.app.sweep;

import com.dds.app.session.SessionStatus;
import com.dds.app.sweep.SweepStats.StatsSnapshot;

public record SweepResult(String sessionId, SessionStatus status, boolean resumed, StatsSnapshot stats) {

    public boolean interrupted() {
        return status == SessionStatus.INTERRUPTED;
    }
}
