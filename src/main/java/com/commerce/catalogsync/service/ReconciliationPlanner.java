package com.commerce.catalogsync.service;

import com.commerce.catalogsync.dto.CatalogIndex;
import com.commerce.catalogsync.dto.CatalogItem;
import com.commerce.catalogsync.dto.DecisionType;
import com.commerce.catalogsync.dto.ReconciliationDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Joins two catalog indices by SKU and decides what to do with each SKU.
 * <p>
 * The source platform is always authoritative: a matched SKU whose target price is out of
 * tolerance gets the source price (after the pricing policy) pushed to the target.
 * Pure function of its inputs; decisions come out in SKU lexical order.
 */
@Component
@Slf4j
public class ReconciliationPlanner {

    public List<ReconciliationDecision> plan(CatalogIndex source, CatalogIndex target, PricingPolicy policy) {
        SortedSet<String> skus = new TreeSet<>(source.skus());
        skus.addAll(target.skus());

        List<ReconciliationDecision> decisions = new ArrayList<>(skus.size());
        Map<DecisionType, Integer> counts = new EnumMap<>(DecisionType.class);
        for (String sku : skus) {
            ReconciliationDecision decision = decide(sku,
                    source.get(sku).orElse(null), target.get(sku).orElse(null), policy);
            counts.merge(decision.getType(), 1, Integer::sum);
            decisions.add(decision);
        }

        log.info("Planned {} SKUs between {} and {}: {}", decisions.size(),
                source.getPlatformName(), target.getPlatformName(), counts);
        return List.copyOf(decisions);
    }

    private ReconciliationDecision decide(String sku, CatalogItem sourceItem, CatalogItem targetItem,
                                          PricingPolicy policy) {
        if (targetItem == null) {
            log.debug("SKU {} only exists on the source platform", sku);
            return ReconciliationDecision.builder()
                    .type(DecisionType.SOURCE_ONLY)
                    .sku(sku)
                    .sourceItem(sourceItem)
                    .sourcePrice(sourceItem.getPrice())
                    .build();
        }
        if (sourceItem == null) {
            log.debug("SKU {} only exists on the target platform", sku);
            return ReconciliationDecision.builder()
                    .type(DecisionType.TARGET_ONLY)
                    .sku(sku)
                    .targetItem(targetItem)
                    .targetPrice(targetItem.getPrice())
                    .build();
        }

        BigDecimal desired = policy.desiredTargetPrice(sourceItem.getPrice());
        BigDecimal current = targetItem.getPrice();
        DecisionType type = policy.requiresUpdate(desired, current)
                ? DecisionType.MATCHED_UPDATE
                : DecisionType.MATCHED_NOOP;

        return ReconciliationDecision.builder()
                .type(type)
                .sku(sku)
                .sourceItem(sourceItem)
                .targetItem(targetItem)
                .sourcePrice(sourceItem.getPrice())
                .targetPrice(current)
                .desiredPrice(desired)
                .delta(desired.subtract(current))
                .build();
    }
}
