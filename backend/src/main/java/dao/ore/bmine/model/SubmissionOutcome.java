package dao.ore.bmine.model;

public enum SubmissionOutcome {
    LANDED,
    DROPPED
}
