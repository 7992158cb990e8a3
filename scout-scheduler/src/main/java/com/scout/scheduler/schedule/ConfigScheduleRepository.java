package com.scout.scheduler.schedule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scout.common.config.ConfigException;
import com.scout.common.config.ConfigService;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Schedules stored in the {@code schedules} list of {@code config.yaml}.
 * <p>
 * State is written by editing the document tree in place, so keys this
 * class does not know about survive the round trip.
 */
@Slf4j
public class ConfigScheduleRepository implements ScheduleRepository {

    private static final String SCHEDULES = "schedules";
    private static final String STATE = "_state";
    private static final String TIMEZONE = "timezone";

    private final ConfigService configService;
    private final ObjectMapper mapper;

    public ConfigScheduleRepository(ConfigService configService) {
        this.configService = configService;
        this.mapper = configService.getYamlMapper();
    }

    @Override
    public List<ScheduleDefinition> loadAll() {
        JsonNode schedules = configService.loadTree().path(SCHEDULES);
        List<ScheduleDefinition> result = new ArrayList<>();
        if (!schedules.isArray()) {
            return result;
        }
        for (JsonNode node : schedules) {
            try {
                ScheduleDefinition def = mapper.treeToValue(node, ScheduleDefinition.class);
                if (def.getName() == null || def.getName().isBlank()) {
                    log.warn("Skipping schedule without a name");
                    continue;
                }
                result.add(def);
            } catch (JsonProcessingException e) {
                log.error("Skipping malformed schedule {}: {}", node.path("name").asText("?"), e.getOriginalMessage());
            }
        }
        return result;
    }

    @Override
    public ZoneId loadZone() {
        String id = configService.loadTree().path(TIMEZONE).asText("");
        if (id.isBlank()) {
            return null;
        }
        try {
            return ZoneId.of(id.trim());
        } catch (DateTimeException e) {
            log.warn("Ignoring invalid timezone '{}': {}", id, e.getMessage());
            return null;
        }
    }

    @Override
    public synchronized void saveState(String scheduleName, ScheduleState state) {
        ObjectNode tree = configService.loadTree();
        JsonNode schedules = tree.path(SCHEDULES);
        if (schedules.isArray()) {
            for (JsonNode node : schedules) {
                if (node.isObject() && scheduleName.equals(node.path("name").asText())) {
                    ((ObjectNode) node).set(STATE, mapper.valueToTree(state));
                    configService.saveTree(tree);
                    return;
                }
            }
        }
        throw new ConfigException("Schedule not found: " + scheduleName);
    }
}
