package com.work.healthcheck.demo.web.dto;

import com.work.healthcheck.core.engine.EngineState;
import com.work.healthcheck.core.engine.HealthLoop;
import com.work.healthcheck.core.engine.ProbeOutcome;
import com.work.healthcheck.core.engine.RoundResult;
import com.work.healthcheck.demo.config.HealthcheckProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class HealthcheckStatusResponse {

    private boolean enabled;
    private EngineState state;
    private int rank;
    private int worldSize;
    private int localWorldSize;
    private int lastFailureCount = -1;
    private long roundsCompleted;
    private Instant lastRoundStartedAt;
    private List<ProbeOutcomeView> lastOutcomes = Collections.emptyList();

    public static HealthcheckStatusResponse disabled(HealthcheckProperties properties) {
        HealthcheckStatusResponse resp = base(properties);
        resp.enabled = false;
        return resp;
    }

    public static HealthcheckStatusResponse fromLoop(HealthLoop loop, HealthcheckProperties properties) {
        HealthcheckStatusResponse resp = base(properties);
        resp.enabled = true;
        resp.state = loop.getState();
        resp.lastFailureCount = loop.getLastFailureCount();
        resp.roundsCompleted = loop.getRoundsCompleted();
        RoundResult round = loop.getLastRound();
        if (round != null) {
            resp.lastRoundStartedAt = round.getStartedAt();
            List<ProbeOutcomeView> views = new ArrayList<>(round.getOutcomes().size());
            for (ProbeOutcome outcome : round.getOutcomes()) {
                views.add(ProbeOutcomeView.from(outcome));
            }
            resp.lastOutcomes = views;
        }
        return resp;
    }

    private static HealthcheckStatusResponse base(HealthcheckProperties properties) {
        HealthcheckStatusResponse resp = new HealthcheckStatusResponse();
        resp.rank = properties.getRank();
        resp.worldSize = properties.getWorldSize();
        resp.localWorldSize = properties.getLocalWorldSize();
        return resp;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public EngineState getState() {
        return state;
    }

    public int getRank() {
        return rank;
    }

    public int getWorldSize() {
        return worldSize;
    }

    public int getLocalWorldSize() {
        return localWorldSize;
    }

    public int getLastFailureCount() {
        return lastFailureCount;
    }

    public long getRoundsCompleted() {
        return roundsCompleted;
    }

    public Instant getLastRoundStartedAt() {
        return lastRoundStartedAt;
    }

    public List<ProbeOutcomeView> getLastOutcomes() {
        return lastOutcomes;
    }
}
