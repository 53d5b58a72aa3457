package ru.tigran.quotaadmission.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import ru.tigran.quotaadmission.dto.QuotaDimension;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class QuotaRule {

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private QuotaDimension dimension;

    @Column(name = "rule_value", nullable = false, length = 200)
    private String value;

    @Column(nullable = false)
    private Integer cap;

    @Column(nullable = false)
    private Boolean active = true;
}
