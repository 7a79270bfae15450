package org.dbsync.migration;

import lombok.extern.slf4j.Slf4j;
import org.dbsync.model.ForeignKeyModel;
import org.dbsync.model.TableModel;
import org.dbsync.model.naming.CaseNormalizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Orders tables so that every referenced table comes before the tables that
 * reference it. Only references between the given tables count; references
 * to tables outside the set already exist on the target. Ties are broken
 * alphabetically.
 */
@Slf4j
public class TableDependencySorter {
    private final CaseNormalizer normalizer;

    public TableDependencySorter() {
        this(CaseNormalizer.lower());
    }

    public TableDependencySorter(CaseNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * @throws DependencyCycleException when two or more tables reference each other
     */
    public DependencyOrder strictOrder(Collection<TableModel> tables) {
        Graph graph = new Graph(tables);
        List<List<String>> cycles = graph.cycles();
        if (!cycles.isEmpty()) {
            throw new DependencyCycleException(cycles);
        }
        return new DependencyOrder(graph.kahn(Set.of()), List.of(), List.of());
    }

    /**
     * Breaks every cycle by deferring the foreign keys between members of the
     * same cycle; the rest of the order is the same as {@link #strictOrder}.
     */
    public DependencyOrder orderWithDeferral(Collection<TableModel> tables) {
        Graph graph = new Graph(tables);
        List<List<String>> cycles = graph.cycles();

        List<DeferredForeignKey> deferred = new ArrayList<>();
        Set<String> cutEdges = new HashSet<>();
        for (List<String> cycle : cycles) {
            Set<String> members = new HashSet<>(cycle);
            for (String key : cycle) {
                TableModel table = graph.nodes.get(key);
                for (ForeignKeyModel fk : table.getForeignKeys()) {
                    String ref = normalizer.normalize(fk.getReferencedTable());
                    if (!ref.equals(key) && members.contains(ref)) {
                        deferred.add(new DeferredForeignKey(table.getName(), fk));
                        cutEdges.add(key + "->" + ref);
                    }
                }
            }
            log.warn("Foreign key cycle between new tables {}; constraints will be added after creation", cycle);
        }
        return new DependencyOrder(graph.kahn(cutEdges), List.copyOf(deferred), cycles);
    }

    private final class Graph {
        final Map<String, TableModel> nodes = new TreeMap<>();
        final Map<String, Set<String>> edges = new TreeMap<>();

        Graph(Collection<TableModel> tables) {
            for (TableModel t : tables) {
                nodes.put(normalizer.normalize(t.getName()), t);
            }
            nodes.forEach((key, table) -> {
                Set<String> refs = new TreeSet<>();
                for (ForeignKeyModel fk : table.getForeignKeys()) {
                    String ref = normalizer.normalize(fk.getReferencedTable());
                    // self references stay inline
                    if (!ref.equals(key) && nodes.containsKey(ref)) {
                        refs.add(ref);
                    }
                }
                edges.put(key, refs);
            });
        }

        /** Strongly connected components with more than one table (Tarjan). */
        List<List<String>> cycles() {
            Map<String, Integer> index = new HashMap<>();
            Map<String, Integer> low = new HashMap<>();
            Set<String> onStack = new HashSet<>();
            List<String> stack = new ArrayList<>();
            List<List<String>> result = new ArrayList<>();
            int[] counter = {0};
            for (String node : nodes.keySet()) {
                if (!index.containsKey(node)) {
                    strongConnect(node, index, low, onStack, stack, result, counter);
                }
            }
            result.sort((a, b) -> a.get(0).compareTo(b.get(0)));
            return result;
        }

        private void strongConnect(String node, Map<String, Integer> index, Map<String, Integer> low,
                                   Set<String> onStack, List<String> stack, List<List<String>> result, int[] counter) {
            index.put(node, counter[0]);
            low.put(node, counter[0]);
            counter[0]++;
            stack.add(node);
            onStack.add(node);

            for (String next : edges.get(node)) {
                if (!index.containsKey(next)) {
                    strongConnect(next, index, low, onStack, stack, result, counter);
                    low.put(node, Math.min(low.get(node), low.get(next)));
                } else if (onStack.contains(next)) {
                    low.put(node, Math.min(low.get(node), index.get(next)));
                }
            }

            if (low.get(node).equals(index.get(node))) {
                List<String> component = new ArrayList<>();
                String member;
                do {
                    member = stack.remove(stack.size() - 1);
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(node));
                if (component.size() > 1) {
                    component.sort(String::compareTo);
                    result.add(component);
                }
            }
        }

        /** Kahn's algorithm, smallest name first among the ready tables. */
        List<TableModel> kahn(Set<String> cutEdges) {
            Map<String, Integer> pending = new TreeMap<>();
            Map<String, List<String>> dependents = new HashMap<>();
            nodes.keySet().forEach(k -> pending.put(k, 0));
            edges.forEach((from, refs) -> {
                for (String to : refs) {
                    if (cutEdges.contains(from + "->" + to)) continue;
                    pending.merge(from, 1, Integer::sum);
                    dependents.computeIfAbsent(to, k -> new ArrayList<>()).add(from);
                }
            });

            PriorityQueue<String> ready = new PriorityQueue<>();
            pending.forEach((k, count) -> {
                if (count == 0) ready.add(k);
            });

            List<TableModel> ordered = new ArrayList<>(nodes.size());
            while (!ready.isEmpty()) {
                String key = ready.poll();
                ordered.add(nodes.get(key));
                for (String dependent : dependents.getOrDefault(key, List.of())) {
                    if (pending.merge(dependent, -1, Integer::sum) == 0) {
                        ready.add(dependent);
                    }
                }
            }
            if (ordered.size() != nodes.size()) {
                throw new IllegalStateException("Dependency graph still cyclic after deferral");
            }
            return ordered;
        }
    }
}
