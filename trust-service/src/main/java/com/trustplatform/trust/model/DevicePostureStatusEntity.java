package com.trustplatform.trust.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One recorded checkpoint status for a device. {@code status} holds {@code pass}, {@code fail}
 * or {@code unknown}; {@code checkedAt} is UTC.
 */
@Data
@NoArgsConstructor
@Table("device_posture_status")
public class DevicePostureStatusEntity {

    @Id
    private Long id;

    private String deviceId;

    private String checkpointName;

    private String status;

    private LocalDateTime checkedAt;
}
