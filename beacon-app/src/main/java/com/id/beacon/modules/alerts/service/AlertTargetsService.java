package com.id.beacon.modules.alerts.service;

import com.id.beacon.modules.alerts.model.AlertTargetEntity;
import com.id.beacon.modules.alerts.model.BeaconAlertTarget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeanUtils;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;

/**
 * CRUD over the cluster → chat routing table used by the alert dispatcher.
 */
@Service
@Slf4j
public class AlertTargetsService {

    private final MongoTemplate mongoTemplate;

    public AlertTargetsService(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public List<BeaconAlertTarget> findAll() {
        return mongoTemplate.find(new Query().with(Sort.by(AlertTargetEntity.CLUSTER_ID)), AlertTargetEntity.class).stream()
                .map(AlertTargetsService::toModel)
                .toList();
    }

    public Optional<BeaconAlertTarget> findByClusterId(String clusterId) {
        return Optional.ofNullable(mongoTemplate.findById(clusterId, AlertTargetEntity.class))
                .map(AlertTargetsService::toModel);
    }

    /**
     * Creates or replaces the target of a cluster.
     *
     * @param clusterId cluster the target belongs to; overrides whatever the model carries
     * @param target    target with a non-blank chat id
     * @return the stored target
     */
    public BeaconAlertTarget save(String clusterId, BeaconAlertTarget target) {
        if (!StringUtils.hasText(clusterId)) {
            throw new IllegalArgumentException("Cluster id cannot be blank");
        }
        if (target == null || !StringUtils.hasText(target.getChatId())) {
            throw new IllegalArgumentException("Chat id cannot be blank");
        }
        var entity = new AlertTargetEntity();
        BeanUtils.copyProperties(target, entity);
        entity.setClusterId(clusterId);
        var saved = mongoTemplate.save(entity);
        log.info("Alert target for cluster '%s' set to chat %s".formatted(clusterId, saved.getChatId()));
        return toModel(saved);
    }

    public boolean delete(String clusterId) {
        var entity = mongoTemplate.findById(clusterId, AlertTargetEntity.class);
        if (entity == null) {
            return false;
        }
        mongoTemplate.remove(entity);
        return true;
    }

    private static BeaconAlertTarget toModel(AlertTargetEntity entity) {
        var model = new BeaconAlertTarget();
        BeanUtils.copyProperties(entity, model);
        return model;
    }
}
