package com.taskpulse.checkin.core.engine.rest.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskpulse.checkin.integration.models.config.CheckInConfigModel;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * New config record. Set at most one of team, user or task; none means the organization default.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CheckInConfigRequest extends CheckInConfigPatchRequest {

    private String teamId;
    private String userId;
    private String taskId;

    public CheckInConfigModel toModel(String orgId) {
        CheckInConfigModel scoped = CheckInConfigModel.builder()
                .orgId(orgId)
                .teamId(blankToNull(teamId))
                .userId(blankToNull(userId))
                .taskId(blankToNull(taskId))
                .build();
        return toPatch().applyTo(scoped);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
