package com.frontdesk.domain.truth.model.valobj;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PathCheckResult(boolean inTree, String flowNodeId, OutOfTreeWarning warning) {
}
