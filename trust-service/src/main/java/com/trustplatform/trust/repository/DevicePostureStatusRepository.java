package com.trustplatform.trust.repository;

import com.trustplatform.trust.model.DevicePostureStatusEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface DevicePostureStatusRepository extends ReactiveCrudRepository<DevicePostureStatusEntity, Long> {

    Flux<DevicePostureStatusEntity> findByDeviceId(String deviceId);
}
