package com.al.ccda2omop.model.ccda;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Encounter {
    @Builder.Default
    private String id = "";
    @Builder.Default
    private CodedValue code = CodedValue.empty();
    @Builder.Default
    private EffectiveTime effectiveTime = EffectiveTime.empty();
}
