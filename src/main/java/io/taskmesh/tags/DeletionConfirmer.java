package io.taskmesh.tags;

/**
 * Two-step confirmation asked before a non-empty tag is deleted without a force flag.
 */
public interface DeletionConfirmer {
    /**
     * First step: does the user want to delete {@code tagName} and its {@code taskCount} tasks?
     */
    boolean confirmIntent(String tagName, int taskCount);

    /**
     * Second step: the tag name as typed back by the user. Deletion proceeds only on an exact
     * match.
     */
    String retypeName(String tagName);

    /**
     * For callers that cannot prompt: every deletion that needs confirmation is declined.
     */
    DeletionConfirmer DECLINE = new DeletionConfirmer() {
        @Override
        public boolean confirmIntent(String tagName, int taskCount) {
            return false;
        }

        @Override
        public String retypeName(String tagName) {
            return "";
        }
    };
}
