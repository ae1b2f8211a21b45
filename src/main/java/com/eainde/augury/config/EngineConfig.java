package com.eainde.augury.config;

import com.eainde.augury.analysis.ExecutionSettings;
import com.eainde.augury.arbitration.ArbitrationSettings;
import com.eainde.augury.conflict.ConflictSettings;
import com.eainde.augury.conversation.ConversationSettings;
import com.eainde.augury.selection.AffinityProfile;
import com.eainde.augury.selection.SelectionSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Binds the {@code augury.*} tunables to the immutable settings objects the engine components take.
 */
@Configuration
public class EngineConfig {

    @Bean
    public SelectionSettings selectionSettings(
            @Value("${augury.selection.max-theories:5}") int maxTheories,
            @Value("${augury.selection.min-theories:3}") int minTheories,
            @Value("${augury.selection.primary-threshold:0.30}") double primaryThreshold,
            @Value("${augury.selection.fallback-threshold:0.15}") double fallbackThreshold,
            @Value("${augury.selection.completeness-weight:0.40}") double completenessWeight,
            @Value("${augury.selection.affinity-weight:0.35}") double affinityWeight,
            @Value("${augury.selection.personality-weight:0.25}") double personalityWeight,
            @Value("${augury.selection.ensure-tier-coverage:false}") boolean ensureTierCoverage) {
        return new SelectionSettings(maxTheories, minTheories, primaryThreshold, fallbackThreshold,
                completenessWeight, affinityWeight, personalityWeight, ensureTierCoverage);
    }

    @Bean
    public AffinityProfile affinityProfile() {
        return AffinityProfile.defaults();
    }

    @Bean
    public ConflictSettings conflictSettings(
            @Value("${augury.conflict.consistent-threshold:0.20}") double consistentThreshold,
            @Value("${augury.conflict.minor-threshold:0.40}") double minorThreshold,
            @Value("${augury.conflict.significant-threshold:0.50}") double significantThreshold,
            @Value("${augury.conflict.confidence-boost:1.5}") double confidenceBoost,
            @Value("${augury.conflict.fallback-dampening:0.5}") double fallbackDampening,
            @Value("${augury.conflict.fallback-confidence-cap:0.5}") double fallbackConfidenceCap) {
        return new ConflictSettings(consistentThreshold, minorThreshold, significantThreshold, confidenceBoost,
                fallbackDampening, fallbackConfidenceCap);
    }

    @Bean
    public ArbitrationSettings arbitrationSettings(
            @Value("${augury.arbitration.match-bonus:0.10}") double matchBonus,
            @Value("${augury.arbitration.match-confidence-floor:0.75}") double matchConfidenceFloor,
            @Value("${augury.arbitration.inconclusive-confidence-cap:0.50}") double inconclusiveConfidenceCap,
            @Value("${augury.arbitration.consensus-bonus:0.10}") double consensusBonus) {
        return ArbitrationSettings.withConfidence(matchBonus, matchConfidenceFloor, inconclusiveConfidenceCap,
                consensusBonus);
    }

    @Bean
    public ExecutionSettings executionSettings(
            @Value("${augury.execution.pool-size:8}") int poolSize,
            @Value("${augury.execution.run-timeout:10s}") Duration runTimeout) {
        return new ExecutionSettings(poolSize, runTimeout);
    }

    @Bean
    public ConversationSettings conversationSettings(
            @Value("${augury.conversation.max-retries:3}") int maxRetries,
            @Value("${augury.conversation.max-history:100}") int maxHistory) {
        return new ConversationSettings(maxRetries, maxHistory);
    }
}
