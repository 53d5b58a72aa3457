package ru.tigran.quotaadmission.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import ru.tigran.quotaadmission.dto.CombinationMode;

import java.util.ArrayList;
import java.util.List;

/**
 * Конфигурация квот исследования. Одна конфигурация на исследование;
 * отсутствие конфигурации означает, что квоты не применяются.
 */
@Entity
@Table(name = "quota_configurations", indexes = {
    @Index(name = "idx_quota_config_research", columnList = "research_id", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
@ToString(exclude = "rules")
public class QuotaConfiguration extends AuditableEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "research_id", nullable = false, unique = true, length = 200)
    private String researchId;

    @Enumerated(EnumType.STRING)
    @Column(name = "combination_mode", nullable = false, length = 20)
    private CombinationMode combinationMode;

    @Column(nullable = false)
    private Boolean enabled = true;

    // null - без общего лимита участников
    @Column(name = "participant_limit")
    private Integer participantLimit;

    // Порядок правил определяет порядок инкрементов и откатов
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "quota_rules", joinColumns = @JoinColumn(name = "configuration_id"))
    @OrderColumn(name = "rule_order")
    private List<QuotaRule> rules = new ArrayList<>();
}
