package ru.tigran.quotaadmission.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import ru.tigran.quotaadmission.dto.CombinationMode;
import ru.tigran.quotaadmission.dto.CompositeCapPolicy;
import ru.tigran.quotaadmission.dto.QuotaCell;
import ru.tigran.quotaadmission.dto.QuotaConfig;
import ru.tigran.quotaadmission.dto.QuotaDimension;
import ru.tigran.quotaadmission.dto.QuotaRuleDTO;
import ru.tigran.quotaadmission.util.CellKeyUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps a participant's demographics onto the quota cells they belong to.
 * Pure: no I/O, and the same input always yields the same cells in the same order.
 * That order is the order in which counters are acquired and therefore rolled back.
 */
@Component
public class QuotaCellMatcher {

    private final CompositeCapPolicy compositeCapPolicy;

    @Autowired
    public QuotaCellMatcher(@Value("${app.quota.composite-cap-policy:MIN}") String compositeCapPolicy) {
        this(CompositeCapPolicy.fromValue(compositeCapPolicy));
    }

    public QuotaCellMatcher(CompositeCapPolicy compositeCapPolicy) {
        this.compositeCapPolicy = compositeCapPolicy;
    }

    /**
     * Normalizes raw request demographics: unknown keys and blank values are dropped, values trimmed.
     * When two keys resolve to the same dimension ("age" and "AGE") the first one wins.
     */
    public static Map<QuotaDimension, String> normalize(Map<String, String> rawDemographics) {
        Map<QuotaDimension, String> demographics = new EnumMap<>(QuotaDimension.class);
        if (rawDemographics == null) {
            return demographics;
        }
        rawDemographics.forEach((key, value) -> {
            if (value == null || value.isBlank()) {
                return;
            }
            QuotaDimension.fromKey(key).ifPresent(dimension -> demographics.putIfAbsent(dimension, value.trim()));
        });
        return demographics;
    }

    /**
     * @param demographics normalized participant attributes
     * @param config       quota configuration of the research study
     * @return candidate cells in acquisition order; empty when neither a rule nor a participant limit
     * constrains the participant. The study-wide cell, when configured, always comes first.
     */
    public List<QuotaCell> match(Map<QuotaDimension, String> demographics, QuotaConfig config) {
        List<QuotaCell> ruleCells = config.combinationMode() == CombinationMode.CROSS_PRODUCT
                ? matchCrossProduct(demographics, config)
                : matchPerDimension(demographics, config);
        if (config.participantLimit() == null) {
            return ruleCells;
        }
        List<QuotaCell> cells = new ArrayList<>(ruleCells.size() + 1);
        cells.add(QuotaCell.total(config.researchId(), config.participantLimit()));
        cells.addAll(ruleCells);
        return cells;
    }

    private List<QuotaCell> matchPerDimension(Map<QuotaDimension, String> demographics, QuotaConfig config) {
        Set<String> emitted = new LinkedHashSet<>();
        List<QuotaCell> cells = new ArrayList<>();
        for (QuotaRuleDTO rule : config.rules()) {
            if (!rule.active() || !rule.value().equals(demographics.get(rule.dimension()))) {
                continue;
            }
            String cellKey = CellKeyUtils.singleKey(rule);
            if (emitted.add(cellKey)) {
                cells.add(new QuotaCell(config.researchId(), cellKey, rule.cap(), List.of(rule)));
            }
        }
        return cells;
    }

    private List<QuotaCell> matchCrossProduct(Map<QuotaDimension, String> demographics, QuotaConfig config) {
        Set<QuotaDimension> configured = EnumSet.noneOf(QuotaDimension.class);
        Map<QuotaDimension, QuotaRuleDTO> matched = new EnumMap<>(QuotaDimension.class);
        for (QuotaRuleDTO rule : config.rules()) {
            if (!rule.active()) {
                continue;
            }
            configured.add(rule.dimension());
            if (rule.value().equals(demographics.get(rule.dimension()))) {
                matched.putIfAbsent(rule.dimension(), rule);
            }
        }

        // Без значения по одному из настроенных измерений составную ячейку не определить
        if (matched.isEmpty() || !demographics.keySet().containsAll(configured)) {
            return List.of();
        }

        List<QuotaRuleDTO> contributing = matched.values().stream()
                .sorted(Comparator.comparing(rule -> rule.dimension().name()))
                .toList();
        int cap = compositeCapPolicy.apply(contributing.stream().map(QuotaRuleDTO::cap).toList());
        return List.of(new QuotaCell(config.researchId(), CellKeyUtils.compositeKey(contributing), cap, contributing));
    }
}
