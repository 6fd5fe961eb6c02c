package com.hivemind.core.error;

public class ObjectiveNotFoundException extends HivemindException {

    private final String objectiveId;

    public ObjectiveNotFoundException(String objectiveId) {
        super("Objective not found: " + objectiveId);
        this.objectiveId = objectiveId;
    }

    public String getObjectiveId() {
        return objectiveId;
    }
}
