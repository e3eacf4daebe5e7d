package com.al.ccda2omop.model.ccda;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A coded element: {@code code}, {@code codeSystem}, {@code codeSystemName}
 * and {@code displayName} attributes. Absent attributes are "".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodedValue {
    @Builder.Default
    private String code = "";
    @Builder.Default
    private String codeSystem = "";
    @Builder.Default
    private String codeSystemName = "";
    @Builder.Default
    private String displayName = "";
    @Builder.Default
    private String originalText = "";

    public static CodedValue empty() {
        return CodedValue.builder().build();
    }
}
