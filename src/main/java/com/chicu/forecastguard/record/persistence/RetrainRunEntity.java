package com.chicu.forecastguard.record.persistence;

import com.chicu.forecastguard.retrain.RetrainDecision;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "retrain_run",
        indexes = {
                @Index(name = "idx_retrain_run_parameter_created", columnList = "parameter, created_at DESC")
        }
)
public class RetrainRunEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "parameter", nullable = false, length = 32)
    private String parameter;

    /**
     * null — цикл параметра оборвался до решения (state=FAILED).
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "decision", length = 32)
    private RetrainDecision decision;

    @Column(name = "state", length = 32)
    private String state;

    /**
     * MAE исходного бэктеста (sentinel, если оценить не удалось).
     */
    @Column(name = "backtest_mae")
    private Double backtestMae;

    @Column(name = "final_mae")
    private Double finalMae;

    @Column(name = "attempts_used")
    private Integer attemptsUsed;

    @Column(name = "retrain_success")
    private Boolean retrainSuccess;

    @Lob
    @Column(name = "extra_json")
    private String extraJson;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
