package ru.tigran.quotaadmission.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.quotaadmission.config.CacheConfig;
import ru.tigran.quotaadmission.dto.QuotaConfig;
import ru.tigran.quotaadmission.dto.QuotaConfigRequest;
import ru.tigran.quotaadmission.dto.QuotaRuleDTO;
import ru.tigran.quotaadmission.exception.ErrorCode;
import ru.tigran.quotaadmission.exception.ResourceNotFoundException;
import ru.tigran.quotaadmission.exception.ValidationException;
import ru.tigran.quotaadmission.model.QuotaConfiguration;
import ru.tigran.quotaadmission.model.QuotaRule;
import ru.tigran.quotaadmission.repository.QuotaConfigurationRepository;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Сервис доступа к конфигурациям квот.
 * Чтение кешируется (конфигурация меняется только при настройке исследования),
 * запись сбрасывает запись кеша после commit (кеш transaction aware, см. CacheConfig).
 * Счётчики при замене конфигурации не трогаются.
 */
@Slf4j
@Service
public class QuotaConfigService {

    private final QuotaConfigurationRepository repository;

    public QuotaConfigService(QuotaConfigurationRepository repository) {
        this.repository = repository;
    }

    /**
     * Загружает конфигурацию квот исследования.
     *
     * @param researchId ID исследования
     * @return конфигурация или empty, если квоты для исследования не настроены
     */
    @Cacheable(cacheNames = CacheConfig.QUOTA_CONFIG_CACHE, key = "#researchId", unless = "#result == null")
    @Transactional(readOnly = true)
    public Optional<QuotaConfig> findConfig(String researchId) {
        log.debug("Loading quota configuration for research {}", researchId);
        return repository.findByResearchId(researchId).map(this::mapToConfig);
    }

    @Transactional(readOnly = true)
    public QuotaConfig getConfig(String researchId) {
        return repository.findByResearchId(researchId)
                .map(this::mapToConfig)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Quota configuration not found for research " + researchId,
                        ErrorCode.QUOTA_CONFIG_NOT_FOUND.getCode()
                ));
    }

    /**
     * Создаёт или полностью заменяет конфигурацию квот исследования.
     *
     * @param researchId ID исследования
     * @param request    правила, режим комбинирования и флаг enabled
     * @return сохранённая конфигурация
     */
    @CacheEvict(cacheNames = CacheConfig.QUOTA_CONFIG_CACHE, key = "#researchId")
    @Transactional
    public QuotaConfig saveConfig(String researchId, QuotaConfigRequest request) {
        if (researchId == null || researchId.isBlank()) {
            throw new ValidationException("researchId is required", ErrorCode.VALIDATION_ERROR.getCode());
        }
        if (request.rules().isEmpty() && request.participantLimit() == null) {
            throw new ValidationException(
                    "At least one quota rule or a participant limit is required",
                    ErrorCode.VALIDATION_ERROR.getCode()
            );
        }
        rejectDuplicateRules(request.rules());

        QuotaConfiguration configuration = repository.findByResearchId(researchId)
                .orElseGet(() -> {
                    QuotaConfiguration created = new QuotaConfiguration();
                    created.setResearchId(researchId);
                    return created;
                });

        configuration.setCombinationMode(request.combinationMode());
        configuration.setEnabled(!Boolean.FALSE.equals(request.enabled()));
        configuration.setParticipantLimit(request.participantLimit());
        configuration.getRules().clear();
        request.rules().forEach(rule -> configuration.getRules().add(new QuotaRule(
                rule.dimension(),
                rule.value().trim(),
                rule.cap(),
                rule.active()
        )));

        QuotaConfiguration saved = repository.save(configuration);
        log.info("Quota configuration saved for research {}: {} rules, mode {}, enabled {}, participant limit {}",
                researchId, saved.getRules().size(), saved.getCombinationMode(), saved.getEnabled(),
                saved.getParticipantLimit());

        return mapToConfig(saved);
    }

    private void rejectDuplicateRules(List<QuotaRuleDTO> rules) {
        Set<String> seen = new HashSet<>();
        for (QuotaRuleDTO rule : rules) {
            String key = rule.dimension().name() + "=" + rule.value().trim();
            if (!seen.add(key)) {
                throw new ValidationException(
                        "Duplicate quota rule " + key,
                        ErrorCode.DUPLICATE_QUOTA_RULE.getCode()
                );
            }
        }
    }

    /**
     * Маппинг QuotaConfiguration entity → QuotaConfig.
     */
    private QuotaConfig mapToConfig(QuotaConfiguration configuration) {
        return new QuotaConfig(
                configuration.getResearchId(),
                configuration.getCombinationMode(),
                Boolean.TRUE.equals(configuration.getEnabled()),
                configuration.getRules().stream()
                        .map(rule -> new QuotaRuleDTO(
                                rule.getDimension(),
                                rule.getValue(),
                                rule.getCap(),
                                rule.getActive()
                        ))
                        .toList(),
                configuration.getParticipantLimit()
        );
    }
}
