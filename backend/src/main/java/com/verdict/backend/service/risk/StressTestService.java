package com.verdict.backend.service.risk;

import com.verdict.backend.config.AgentProperties;
import com.verdict.backend.model.Portfolio;
import com.verdict.backend.model.StressTestResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class StressTestService {

    private final AgentProperties agentProperties;

    /**
     * Applies every configured price decline to the current position. Impact is NaN when the portfolio is empty.
     */
    public Map<String, StressTestResult> run(Portfolio portfolio, double lastPrice) {
        double positionValue = portfolio.positionValue(lastPrice);
        double totalValue = portfolio.cash() + positionValue;
        Map<String, StressTestResult> results = new LinkedHashMap<>();
        agentProperties.getRisk().getStressScenarios().forEach((scenario, decline) -> {
            double potentialLoss = positionValue * decline;
            double impact = totalValue > 0 ? potentialLoss / totalValue : Double.NaN;
            results.put(scenario, new StressTestResult(potentialLoss, impact));
        });
        return results;
    }
}
