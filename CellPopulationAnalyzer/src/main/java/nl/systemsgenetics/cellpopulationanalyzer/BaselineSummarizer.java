package nl.systemsgenetics.cellpopulationanalyzer;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import java.util.*;
import java.util.function.Function;

/**
 * Breaks the baseline samples of a cohort down by project, response and sex.
 */
public class BaselineSummarizer {

    /**
     * Counts distinct samples per project, and distinct subjects per response and per sex.
     * For the subject counts every subject is represented by its first baseline sample.
     *
     * @param baselineSamples The baseline rows of a cohort.
     * @return The three grouped tables, keys in natural order. Missing values are grouped under an empty key.
     */
    public BaselineBreakdown summarize(List<BaselineSample> baselineSamples) {
        Map<String, Set<String>> samplesPerProject = new TreeMap<>();
        for (BaselineSample baselineSample : baselineSamples) {
            samplesPerProject
                    .computeIfAbsent(Strings.nullToEmpty(baselineSample.getProject()), project -> new HashSet<>())
                    .add(baselineSample.getSampleId());
        }

        List<BaselineSample> firstSamplePerSubject = deduplicateSubjects(baselineSamples);

        return new BaselineBreakdown(
                toCounts(samplesPerProject),
                countSubjects(firstSamplePerSubject, BaselineSample::getResponse),
                countSubjects(firstSamplePerSubject, BaselineSample::getSex));
    }

    private static List<BaselineSample> deduplicateSubjects(List<BaselineSample> baselineSamples) {
        Map<String, BaselineSample> firstSamplePerSubject = new LinkedHashMap<>();
        for (BaselineSample baselineSample : baselineSamples) {
            firstSamplePerSubject.putIfAbsent(baselineSample.getSubjectId(), baselineSample);
        }
        return new ArrayList<>(firstSamplePerSubject.values());
    }

    private static ImmutableMap<String, Integer> countSubjects(List<BaselineSample> firstSamplePerSubject,
                                                               Function<BaselineSample, String> groupBy) {
        Map<String, Set<String>> subjectsPerGroup = new TreeMap<>();
        for (BaselineSample baselineSample : firstSamplePerSubject) {
            subjectsPerGroup
                    .computeIfAbsent(Strings.nullToEmpty(groupBy.apply(baselineSample)), group -> new HashSet<>())
                    .add(baselineSample.getSubjectId());
        }
        return toCounts(subjectsPerGroup);
    }

    private static ImmutableMap<String, Integer> toCounts(Map<String, Set<String>> groups) {
        ImmutableMap.Builder<String, Integer> counts = ImmutableMap.builder();
        for (Map.Entry<String, Set<String>> group : groups.entrySet()) {
            counts.put(group.getKey(), group.getValue().size());
        }
        return counts.build();
    }
}
