package com.frontdesk.domain.scenario.model.valobj;

import com.frontdesk.types.enums.FollowUpModeEnum;

public record FollowUpSpec(FollowUpModeEnum mode,
                           String questionText,
                           String funnel,
                           String transferTarget) {
}
