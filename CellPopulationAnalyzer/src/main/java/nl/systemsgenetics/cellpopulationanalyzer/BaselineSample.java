package nl.systemsgenetics.cellpopulationanalyzer;

/**
 * A baseline sample of a cohort joined with the sex of its subject.
 */
public class BaselineSample {

    private final String sampleId;
    private final String project;
    private final String subjectId;
    private final String response;
    private final String sex;
    private final int timeFromTreatmentStart;

    BaselineSample(String sampleId, String project, String subjectId, String response, String sex,
                   int timeFromTreatmentStart) {
        this.sampleId = sampleId;
        this.project = project;
        this.subjectId = subjectId;
        this.response = response;
        this.sex = sex;
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

    public String getResponse() {
        return response;
    }

    public String getSex() {
        return sex;
    }

    public int getTimeFromTreatmentStart() {
        return timeFromTreatmentStart;
    }
}
