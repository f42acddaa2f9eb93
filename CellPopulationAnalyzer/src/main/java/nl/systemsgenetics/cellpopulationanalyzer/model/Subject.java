package nl.systemsgenetics.cellpopulationanalyzer.model;

import java.util.Objects;

/**
 * An individual from whom samples were taken.
 */
public class Subject {

    private final String subjectId;
    private final String condition;
    private final int age;
    private final String sex;

    public Subject(String subjectId, String condition, int age, String sex) {
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId");
        this.condition = condition;
        this.age = age;
        this.sex = sex;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getCondition() {
        return condition;
    }

    public int getAge() {
        return age;
    }

    public String getSex() {
        return sex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Subject subject = (Subject) o;
        return age == subject.age &&
                subjectId.equals(subject.subjectId) &&
                Objects.equals(condition, subject.condition) &&
                Objects.equals(sex, subject.sex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectId, condition, age, sex);
    }

    @Override
    public String toString() {
        return "Subject{" + subjectId + ", " + condition + ", " + age + ", " + sex + "}";
    }
}
