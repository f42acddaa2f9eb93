package nl.systemsgenetics.cellpopulationanalyzer.model;

import com.google.common.collect.ImmutableSet;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * A set of equality and set membership predicates over subjects and samples that defines a
 * clinical cohort. A predicate that is null (or an empty response set) does not restrict the cohort.
 */
public class CohortDefinition {

    public static final String DEFAULT_CONDITION = "melanoma";
    public static final String DEFAULT_TREATMENT = "miraclib";
    public static final String DEFAULT_SAMPLE_TYPE = "PBMC";

    private final String condition;
    private final String treatment;
    private final String sampleType;
    private final ImmutableSet<String> responses;
    private final Integer timeFromTreatmentStart;

    public CohortDefinition(String condition, String treatment, String sampleType,
                            Collection<String> responses, Integer timeFromTreatmentStart) {
        this.condition = condition;
        this.treatment = treatment;
        this.sampleType = sampleType;
        this.responses = responses == null ? ImmutableSet.of() : ImmutableSet.copyOf(responses);
        this.timeFromTreatmentStart = timeFromTreatmentStart;
    }

    /**
     * Cohort of responders and non-responders for a condition, treatment and sample type, at any time point.
     */
    public static CohortDefinition responderCohort(String condition, String treatment, String sampleType) {
        return new CohortDefinition(condition, treatment, sampleType,
                Arrays.asList(Sample.RESPONDER, Sample.NON_RESPONDER), null);
    }

    /**
     * Melanoma patients treated with miraclib, PBMC samples, response known.
     */
    public static CohortDefinition defaultResponderCohort() {
        return responderCohort(DEFAULT_CONDITION, DEFAULT_TREATMENT, DEFAULT_SAMPLE_TYPE);
    }

    /**
     * @return The same condition, treatment and sample type restricted to baseline samples,
     * without a restriction on response.
     */
    public CohortDefinition baseline() {
        return new CohortDefinition(condition, treatment, sampleType, null, Sample.BASELINE);
    }

    /**
     * Checks whether a sample belongs to this cohort.
     *
     * @param subject The subject the sample was taken from, or null if the subject is unknown.
     * @param sample The sample to check.
     * @return true if every predicate holds.
     */
    public boolean doesSamplePassFilter(Subject subject, Sample sample) {
        if (condition != null && (subject == null || !condition.equals(subject.getCondition()))) {
            return false;
        }
        if (treatment != null && !treatment.equals(sample.getTreatment())) {
            return false;
        }
        if (sampleType != null && !sampleType.equals(sample.getSampleType())) {
            return false;
        }
        if (!responses.isEmpty() && !responses.contains(sample.getResponse())) {
            return false;
        }
        return timeFromTreatmentStart == null || timeFromTreatmentStart == sample.getTimeFromTreatmentStart();
    }

    public String getCondition() {
        return condition;
    }

    public String getTreatment() {
        return treatment;
    }

    public String getSampleType() {
        return sampleType;
    }

    public Set<String> getResponses() {
        return responses;
    }

    public Integer getTimeFromTreatmentStart() {
        return timeFromTreatmentStart;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CohortDefinition that = (CohortDefinition) o;
        return Objects.equals(condition, that.condition) &&
                Objects.equals(treatment, that.treatment) &&
                Objects.equals(sampleType, that.sampleType) &&
                responses.equals(that.responses) &&
                Objects.equals(timeFromTreatmentStart, that.timeFromTreatmentStart);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, treatment, sampleType, responses, timeFromTreatmentStart);
    }

    @Override
    public String toString() {
        return String.format("condition=%s, treatment=%s, sampleType=%s, responses=%s, timeFromTreatmentStart=%s",
                condition, treatment, sampleType, responses.isEmpty() ? "any" : responses,
                timeFromTreatmentStart == null ? "any" : timeFromTreatmentStart);
    }
}
