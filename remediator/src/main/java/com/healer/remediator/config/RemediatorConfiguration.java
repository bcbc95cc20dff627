package com.healer.remediator.config;

import com.healer.remediator.diagnosis.DiagnosisEngine;
import com.healer.remediator.diagnosis.DiagnosisRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
public class RemediatorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RemediatorConfiguration.class);

    /**
     * Any {@link DiagnosisRule} bean in the context is consulted before the
     * built-in rules, in bean order.
     */
    @Bean
    public DiagnosisEngine diagnosisEngine(ObjectProvider<DiagnosisRule> customRuleBeans) {
        List<DiagnosisRule> customRules = customRuleBeans.orderedStream().toList();
        List<DiagnosisRule> rules = new ArrayList<>(customRules);
        rules.addAll(DiagnosisEngine.defaultRules());
        if (!customRules.isEmpty()) {
            log.info("Diagnosis engine: {} custom rule(s) ahead of {} built-in",
                    customRules.size(), rules.size() - customRules.size());
        }
        return new DiagnosisEngine(rules);
    }
}
