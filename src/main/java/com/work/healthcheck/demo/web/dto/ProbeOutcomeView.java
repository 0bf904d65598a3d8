package com.work.healthcheck.demo.web.dto;

import com.work.healthcheck.core.engine.ProbeOutcome;
import com.work.healthcheck.core.engine.ProbeStatus;

public class ProbeOutcomeView {

    private int side;
    private ProbeStatus status;
    private String reason;

    public static ProbeOutcomeView from(ProbeOutcome outcome) {
        ProbeOutcomeView view = new ProbeOutcomeView();
        view.side = outcome.getSide();
        view.status = outcome.getStatus();
        view.reason = outcome.getReason();
        return view;
    }

    public int getSide() {
        return side;
    }

    public ProbeStatus getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }
}
