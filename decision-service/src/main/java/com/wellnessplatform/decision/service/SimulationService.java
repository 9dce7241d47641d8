package com.wellnessplatform.decision.service;

import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.model.TradeOffDecision;
import com.wellnessplatform.common.simulation.SimulationResult;
import com.wellnessplatform.common.simulation.SimulationScenario;
import com.wellnessplatform.common.simulation.WeekSimulator;
import com.wellnessplatform.decision.dto.SimulationRequest;
import com.wellnessplatform.decision.repository.HealthDataRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs a week projection from the latest recorded state. Needs
 * {@value WeekSimulator#MIN_HISTORY} recorded decisions first; the simulated days are
 * never written to history.
 */
@Service
public class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private final WeekSimulator simulator;
    private final HealthDataRepository repository;

    public SimulationService(WeekSimulator simulator, HealthDataRepository repository) {
        this.simulator  = simulator;
        this.repository = repository;
    }

    public Mono<SimulationResult> simulate(SimulationRequest request) {
        return Mono.fromCallable(() -> {
            List<TradeOffDecision> history = repository.history();
            if (history.size() < WeekSimulator.MIN_HISTORY) {
                int missing = WeekSimulator.MIN_HISTORY - history.size();
                throw new IllegalArgumentException("Insufficient data. Record " + missing
                    + " more decision(s) to calibrate the simulation.");
            }

            StateSnapshot start = request.state() != null
                ? request.state()
                : history.get(history.size() - 1).stateSnapshot();
            double dailyHours = request.dailyHours() != null
                ? Math.max(0.0, request.dailyHours())
                : start.timeAvailableHours();
            SimulationScenario scenario = request.scenario() != null
                ? request.scenario()
                : SimulationScenario.PREVENTIVE;

            SimulationResult result = simulator.simulate(start, scenario, dailyHours, request.tasks(),
                repository.profile().preferences(), history.size());
            log.info("[Simulation] Week projected. scenario={} dailyHours={} burnoutDays={} averageSleep={}",
                     scenario.wireName(), dailyHours, result.summary().burnoutDays(), result.summary().averageSleep());
            return result;
        });
    }
}
