package com.treeroll.service.core.rollup;

import com.treeroll.service.core.config.RegistrySnapshot;
import com.treeroll.service.core.config.RollupRegistry;
import com.treeroll.service.core.engine.GroupMembers;
import com.treeroll.service.core.fact.FactRow;
import com.treeroll.service.core.fact.FactSchemaValidator;
import com.treeroll.service.core.fact.FactSource;
import com.treeroll.service.core.fact.FactTable;
import com.treeroll.service.core.hierarchy.HierarchyPlan;
import com.treeroll.service.core.hierarchy.HierarchyPlanner;
import com.treeroll.service.core.hierarchy.HierarchySpec;
import com.treeroll.service.core.hierarchy.Level;
import com.treeroll.service.core.model.ReportRow;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs a hierarchy over a fact table: plan and schema checks first, then one pass per level from the leaf
 * up, each level consuming the complete output of the one below, and finally the root.
 */
@Slf4j
@Service
public class RollupService {
    private final RollupRegistry registry;
    private final HierarchyPlanner planner;
    private final FactSchemaValidator schemaValidator;
    private final LevelAggregator aggregator;
    private final TopNLimiter limiter;
    private final TreeAssembler assembler;
    private final RootFinalizer rootFinalizer;
    private final GroupWorkerPool workerPool;
    private final PlanCache planCache;

    public RollupService(
            RollupRegistry registry,
            HierarchyPlanner planner,
            FactSchemaValidator schemaValidator,
            LevelAggregator aggregator,
            TopNLimiter limiter,
            TreeAssembler assembler,
            RootFinalizer rootFinalizer,
            GroupWorkerPool workerPool,
            PlanCache planCache) {
        this.registry = registry;
        this.planner = planner;
        this.schemaValidator = schemaValidator;
        this.aggregator = aggregator;
        this.limiter = limiter;
        this.assembler = assembler;
        this.rootFinalizer = rootFinalizer;
        this.workerPool = workerPool;
        this.planCache = planCache;
    }

    /** Runs a hierarchy registered in the definitions. Its plan is reused until the definitions reload. */
    public ReportRow rollup(String hierarchyId, FactSource source) {
        RegistrySnapshot snapshot = registry.current();
        HierarchySpec spec = snapshot.hierarchies().get(hierarchyId);
        if (spec == null) {
            throw new IllegalArgumentException("Unknown hierarchy: " + hierarchyId);
        }
        HierarchyPlan plan = planCache.get(
                snapshot, hierarchyId, id -> planner.plan(spec, snapshot.metrics(), snapshot.dimensions()));
        FactTable facts = source.read();
        return execute(plan, facts, source.describe());
    }

    /** Plans before touching the source, so configuration errors never cost a read. */
    public ReportRow rollup(HierarchySpec spec, FactSource source) {
        HierarchyPlan plan = plan(spec);
        FactTable facts = source.read();
        return execute(plan, facts, source.describe());
    }

    public ReportRow rollup(HierarchySpec spec, FactTable facts) {
        return execute(plan(spec), facts, "in-memory");
    }

    /**
     * Runs rows posted with a request. Their schema is the union of the columns they carry; with no rows it
     * is the plan's own columns, so an empty post yields an empty root.
     */
    public ReportRow rollupRows(HierarchySpec spec, List<FactRow> rows) {
        HierarchyPlan plan = plan(spec);
        FactTable facts = rows.isEmpty()
                ? new FactTable(schemaValidator.requiredSchema(plan), rows)
                : FactTable.inferred(rows);
        return execute(plan, facts, "request");
    }

    public HierarchyPlan plan(HierarchySpec spec) {
        RegistrySnapshot snapshot = registry.current();
        return planner.plan(spec, snapshot.metrics(), snapshot.dimensions());
    }

    ReportRow execute(HierarchyPlan plan, FactTable facts, String sourceName) {
        schemaValidator.validate(plan, facts.schema());
        long t0 = System.nanoTime();

        List<CarriedRow> previous = List.of();
        for (Level level : plan.levels()) {
            if (level.isRoot()) {
                break;
            }
            checkNotCancelled(plan, level);
            long levelStart = System.nanoTime();
            if (level.isLeaf()) {
                List<GroupMembers<List<String>, FactRow>> members = aggregator.groupFacts(facts.rows(), plan.path());
                previous = workerPool.mapAll(
                        members,
                        m -> assembler.assemble(level, null, aggregator.aggregateFacts(level, m), LimitedChildren.none()));
            } else {
                Level child = plan.childOf(level);
                int inputRows = previous.size();
                List<GroupMembers<List<String>, CarriedRow>> members = aggregator.groupChildren(previous);
                previous = workerPool.mapAll(members, m -> {
                    Group group = aggregator.aggregateChildren(level, child, m);
                    return assembler.assemble(level, child, group, limiter.limit(group, child));
                });
                log.debug("Rollup {} level {} ({}) grouped {} rows into {} groups",
                        plan.id(), level.index(), level.dimensionId(), inputRows, previous.size());
            }
            log.debug("Rollup {} level {} ({}) produced {} rows in {} us",
                    plan.id(), level.index(), level.dimensionId(), previous.size(),
                    (System.nanoTime() - levelStart) / 1_000L);
        }

        Level root = plan.root();
        checkNotCancelled(plan, root);
        Group rootGroup;
        LimitedChildren rootChildren;
        if (root.isLeaf()) {
            rootGroup = aggregator.aggregateFacts(root, new GroupMembers<>(List.of(), facts.rows()));
            rootChildren = LimitedChildren.none();
        } else {
            Level child = plan.childOf(root);
            rootGroup = aggregator.aggregateChildren(root, child, new GroupMembers<>(List.of(), previous));
            rootChildren = limiter.limit(rootGroup, child);
        }
        ReportRow tree = rootFinalizer.finalizeRoot(plan, rootGroup, rootChildren);
        log.info("Rollup {} from {}: facts={}, levels={}, topRows={} in {} ms",
                plan.id(), sourceName, facts.size(), plan.depth(), tree.children().size(),
                (System.nanoTime() - t0) / 1_000_000L);
        return tree;
    }

    private static void checkNotCancelled(HierarchyPlan plan, Level level) {
        if (Thread.currentThread().isInterrupted()) {
            throw new IllegalStateException(
                    "Rollup '" + plan.id() + "' cancelled before level " + level.index());
        }
    }
}
