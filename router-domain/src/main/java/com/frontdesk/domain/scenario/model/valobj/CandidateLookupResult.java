package com.frontdesk.domain.scenario.model.valobj;

import com.frontdesk.types.enums.MatchMethodEnum;

import java.util.List;

/**
 * 候选检索结果。
 *
 * @param exactMatch 精确命中的场景，非 exact 方式时为 null
 * @param candidates 交给下游打分的候选（最多 20 个）
 * @param method 命中方式
 */
public record CandidateLookupResult(RuntimeSpec exactMatch,
                                    List<RuntimeSpec> candidates,
                                    MatchMethodEnum method) {
}
