package com.netai.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Device with records exceeding at least one performance threshold")
public class ProblematicDevice {

    @Schema(example = "AP-FLOOR2-07")
    private String deviceId;

    @Schema(example = "access_point")
    private String deviceType;

    @Schema(description = "Records of this device exceeding any threshold", example = "31")
    private long issueCount;
}
