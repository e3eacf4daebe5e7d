package com.al.ccda2omop.model.omop;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceExposure implements OmopRow {
    private Long deviceExposureId;
    private Long personId;
    @Builder.Default
    private Long deviceConceptId = 0L;
    private LocalDate deviceExposureStartDate;
    private LocalDateTime deviceExposureStartDatetime;
    private LocalDate deviceExposureEndDate;
    private LocalDateTime deviceExposureEndDatetime;
    private Long deviceTypeConceptId;
    private String uniqueDeviceId;
    private Integer quantity;
    private Long providerId;
    private Long visitOccurrenceId;
    private Long visitDetailId;
    private String deviceSourceValue;
    private Long deviceSourceConceptId;
    private String mappingRule;
    private String sourceFile;

    @Override
    public OmopTable table() {
        return OmopTable.DEVICE_EXPOSURE;
    }

    @Override
    public List<Object> values() {
        return Arrays.asList(deviceExposureId, personId, deviceConceptId, deviceExposureStartDate,
                deviceExposureStartDatetime, deviceExposureEndDate, deviceExposureEndDatetime,
                deviceTypeConceptId, uniqueDeviceId, quantity, providerId, visitOccurrenceId, visitDetailId,
                deviceSourceValue, deviceSourceConceptId, mappingRule, sourceFile);
    }
}
