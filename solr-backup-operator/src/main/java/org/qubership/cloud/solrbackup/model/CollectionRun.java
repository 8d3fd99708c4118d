package org.qubership.cloud.solrbackup.model;

public record CollectionRun(String collection, String backupName, CollectionOutcome outcome) {

    public boolean isFinished() {
        return outcome.isFinished();
    }

    public boolean isSuccessful() {
        return outcome instanceof CollectionOutcome.Finished finished && finished.successful();
    }

    public CollectionRun withOutcome(CollectionOutcome newOutcome) {
        return new CollectionRun(collection, backupName, newOutcome);
    }
}
