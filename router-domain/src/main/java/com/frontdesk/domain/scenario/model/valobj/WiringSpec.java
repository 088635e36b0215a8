package com.frontdesk.domain.scenario.model.valobj;

import com.frontdesk.types.enums.ActionTypeEnum;

import java.util.List;

public record WiringSpec(ActionTypeEnum actionType,
                         String flowId,
                         boolean bookingIntent,
                         List<String> requiredSlots,
                         boolean stopRouting) {
}
