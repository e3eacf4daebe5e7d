package com.al.ccda2omop.model.ccda;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A point in time ({@code @value}) or an interval ({@code low}/{@code high}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EffectiveTime {
    private LocalDateTime value;
    private LocalDateTime low;
    private LocalDateTime high;

    public static EffectiveTime empty() {
        return new EffectiveTime();
    }

    /**
     * Interval start, or the point value when there is no low bound.
     */
    public LocalDateTime start() {
        return low != null ? low : value;
    }
}
