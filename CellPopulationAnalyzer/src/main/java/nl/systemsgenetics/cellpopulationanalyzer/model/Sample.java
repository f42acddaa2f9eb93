package nl.systemsgenetics.cellpopulationanalyzer.model;

import java.util.Objects;

/**
 * A sample taken from a subject at some point relative to the start of treatment.
 */
public class Sample {

    public static final String RESPONDER = "yes";
    public static final String NON_RESPONDER = "no";
    public static final int BASELINE = 0;

    private final String sampleId;
    private final String project;
    private final String subjectId;
    private final String treatment;
    private final String response;
    private final String sampleType;
    private final int timeFromTreatmentStart;

    /**
     * @param response "yes", "no", or null / empty when the response is unknown.
     * @param timeFromTreatmentStart Signed time point, 0 being baseline.
     */
    public Sample(String sampleId, String project, String subjectId, String treatment, String response,
                  String sampleType, int timeFromTreatmentStart) {
        this.sampleId = Objects.requireNonNull(sampleId, "sampleId");
        this.project = project;
        this.subjectId = subjectId;
        this.treatment = treatment;
        this.response = response;
        this.sampleType = sampleType;
        this.timeFromTreatmentStart = timeFromTreatmentStart;
    }

    public String getSampleId() {
        return sampleId;
    }

    public String getProject() {
        return project;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getTreatment() {
        return treatment;
    }

    public String getResponse() {
        return response;
    }

    public String getSampleType() {
        return sampleType;
    }

    public int getTimeFromTreatmentStart() {
        return timeFromTreatmentStart;
    }

    public boolean isBaseline() {
        return timeFromTreatmentStart == BASELINE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Sample sample = (Sample) o;
        return timeFromTreatmentStart == sample.timeFromTreatmentStart &&
                sampleId.equals(sample.sampleId) &&
                Objects.equals(project, sample.project) &&
                Objects.equals(subjectId, sample.subjectId) &&
                Objects.equals(treatment, sample.treatment) &&
                Objects.equals(response, sample.response) &&
                Objects.equals(sampleType, sample.sampleType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sampleId, project, subjectId, treatment, response, sampleType, timeFromTreatmentStart);
    }

    @Override
    public String toString() {
        return "Sample{" + sampleId + ", subject " + subjectId + ", " + treatment + ", " + sampleType +
                ", response " + response + ", t=" + timeFromTreatmentStart + "}";
    }
}
