package com.al.ccda2omop.model.ccda;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Patient demographics from {@code recordTarget/patientRole}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Patient {
    @Builder.Default
    private String id = "";
    @Builder.Default
    private String givenName = "";
    @Builder.Default
    private String familyName = "";
    private LocalDateTime birthTime;
    @Builder.Default
    private CodedValue gender = CodedValue.empty();
    @Builder.Default
    private CodedValue race = CodedValue.empty();
    @Builder.Default
    private CodedValue ethnicity = CodedValue.empty();
}
