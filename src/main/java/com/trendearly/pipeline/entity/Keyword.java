package com.trendearly.pipeline.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(
        name = "keywords",
        uniqueConstraints = @UniqueConstraint(columnNames = {"text"})
)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Keyword {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 정규화된 텍스트 (trim, 소문자, 공백 축약) */
    @Column(nullable = false, length = 255)
    private String text;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private KeywordType type;

    @Column(name = "first_seen", nullable = false)
    private LocalDate firstSeen;

    @Column(name = "last_seen", nullable = false)
    private LocalDate lastSeen;

    public void markSeen(LocalDate date) {
        if (lastSeen == null || date.isAfter(lastSeen)) {
            this.lastSeen = date;
        }
    }
}
