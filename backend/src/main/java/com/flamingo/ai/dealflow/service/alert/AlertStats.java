package com.flamingo.ai.dealflow.service.alert;

import com.flamingo.ai.dealflow.domain.enums.AlertKind;
import java.util.Map;

/** Alert counts, with unresolved alerts broken down by kind. */
public record AlertStats(long total, long unresolved, Map<AlertKind, Long> unresolvedByKind) {}
