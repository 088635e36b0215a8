package com.frontdesk.domain.truth.model.valobj;

import java.util.List;

public record BundleValidationResult(boolean valid, List<String> errors) {
}
