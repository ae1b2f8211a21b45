package com.eainde.augury.theory;

import com.eainde.augury.theory.runner.SeededTheoryRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only, process-wide catalog of theories indexed by name.
 *
 * <p>Built once at startup from the descriptors and every {@link TheoryRunner} bean.
 * Theories without a dedicated runner are served by a {@link SeededTheoryRunner}.
 * The orchestration core only sees {@link TheoryDescriptor} and {@link TheoryResult};
 * concrete runners stay behind {@link #runnerFor(String)}.</p>
 */
@Slf4j
@Component
public class TheoryRegistry {

    private final Map<String, TheoryDescriptor> descriptors;
    private final Map<String, TheoryRunner> runners;

    @Autowired
    public TheoryRegistry(List<TheoryRunner> runnerBeans) {
        this(TheoryCatalog.descriptors(), runnerBeans);
    }

    private TheoryRegistry(List<TheoryDescriptor> descriptorList, List<TheoryRunner> runnerList) {
        Map<String, TheoryDescriptor> byName = new LinkedHashMap<>();
        for (TheoryDescriptor descriptor : descriptorList) {
            if (byName.putIfAbsent(descriptor.getName(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate theory: " + descriptor.getName());
            }
        }

        Map<String, TheoryRunner> runnerByName = new LinkedHashMap<>();
        for (TheoryRunner runner : runnerList) {
            if (!byName.containsKey(runner.theoryName())) {
                log.warn("Ignoring runner {} for unknown theory '{}'", runner.getClass().getSimpleName(), runner.theoryName());
                continue;
            }
            runnerByName.put(runner.theoryName(), runner);
        }
        for (String name : byName.keySet()) {
            if (!runnerByName.containsKey(name)) {
                runnerByName.put(name, new SeededTheoryRunner(name));
            }
        }

        // Keep runner order aligned with declaration order
        Map<String, TheoryRunner> ordered = new LinkedHashMap<>();
        byName.keySet().forEach(name -> ordered.put(name, runnerByName.get(name)));

        this.descriptors = Collections.unmodifiableMap(byName);
        this.runners = Collections.unmodifiableMap(ordered);
        log.info("Theory registry initialized with {} theories: {}", descriptors.size(), descriptors.keySet());
    }

    public static TheoryRegistry of(List<TheoryDescriptor> descriptors, List<TheoryRunner> runners) {
        return new TheoryRegistry(descriptors, runners);
    }

    /** Descriptors in declaration order. */
    public List<TheoryDescriptor> descriptors() {
        return List.copyOf(descriptors.values());
    }

    public List<String> names() {
        return List.copyOf(descriptors.keySet());
    }

    public boolean contains(String name) {
        return descriptors.containsKey(name);
    }

    public Optional<TheoryDescriptor> find(String name) {
        return Optional.ofNullable(descriptors.get(name));
    }

    public TheoryDescriptor descriptor(String name) {
        TheoryDescriptor descriptor = descriptors.get(name);
        if (descriptor == null) {
            throw new IllegalArgumentException("Unknown theory: " + name);
        }
        return descriptor;
    }

    /** Position in declaration order, used to break ties. */
    public int declarationIndex(String name) {
        int index = 0;
        for (String key : descriptors.keySet()) {
            if (key.equals(name)) {
                return index;
            }
            index++;
        }
        return Integer.MAX_VALUE;
    }

    public TheoryRunner runnerFor(String name) {
        TheoryRunner runner = runners.get(name);
        if (runner == null) {
            throw new IllegalArgumentException("Unknown theory: " + name);
        }
        return runner;
    }

    public int size() {
        return descriptors.size();
    }
}
