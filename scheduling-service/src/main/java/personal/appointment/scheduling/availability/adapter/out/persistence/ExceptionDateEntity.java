package personal.appointment.scheduling.availability.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.appointment.scheduling.availability.domain.model.ExceptionDate;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Exception Date JPA Entity
 * 날짜 유니크 인덱스가 중복 등록의 2차 방어선 역할
 */
@Entity
@Table(name = "exception_dates",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_exception_date",
                columnNames = {"exception_date"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ExceptionDateEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "exception_date", nullable = false)
    private LocalDate date;

    @Column(nullable = false, length = ExceptionDate.MAX_REASON_LENGTH)
    private String reason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static ExceptionDateEntity fromDomain(ExceptionDate exceptionDate) {
        ExceptionDateEntity entity = new ExceptionDateEntity();
        entity.id = exceptionDate.id();
        entity.date = exceptionDate.date();
        entity.reason = exceptionDate.reason();
        entity.createdAt = exceptionDate.createdAt();
        return entity;
    }

    public ExceptionDate toDomain() {
        return new ExceptionDate(id, date, reason, createdAt);
    }
}
