package com.leadengine.domain.matching.model.valobj;

import java.util.List;

/**
 * 单对房源-线索的匹配判定。
 *
 * @param matched 是否匹配
 * @param score   实际比较过的条件中命中的比例，没有可比较条件时为 0
 * @param reasons 实际比较且命中的条件
 */
public record MatchEvaluation(boolean matched, double score, List<String> reasons) {

    public static MatchEvaluation rejected() {
        return new MatchEvaluation(false, 0D, List.of());
    }
}
