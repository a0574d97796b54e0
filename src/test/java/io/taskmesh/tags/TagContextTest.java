package io.taskmesh.tags;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskmesh.config.TaskMeshConfig;
import io.taskmesh.error.ConfirmationDeclinedException;
import io.taskmesh.error.NotFoundException;
import io.taskmesh.error.ReservedNameException;
import io.taskmesh.error.ValidationException;
import io.taskmesh.model.TaggedDocument;
import io.taskmesh.model.TaskStatus;
import io.taskmesh.storage.StateStore;
import io.taskmesh.storage.TaskDocumentStore;
import io.taskmesh.tasks.TaskContent;
import io.taskmesh.tasks.TaskOperations;
import io.taskmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

final class TagContextTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-05T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void copiedTagIsIsolatedFromItsSource() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-tag-copy-isolation-");
        try {
            TagContext tags = context(root, VcsProbe.NONE);
            new TaskOperations(tags, null, CLOCK).addTask(TaskContent.titled("Original"), List.of(), null);

            TagContext.TagCreated created = tags.createTag("feature", new TagContext.CreateOptions(true, null, null));
            Assertions.assertEquals(1, created.tasksCopied());
            Assertions.assertEquals("master", created.sourceTag());

            new TaskOperations(tags, "feature", CLOCK).setStatus("1", TaskStatus.DONE);

            TaskDocumentStore store = new TaskDocumentStore(CLOCK);
            TaggedDocument document = store.load(tags.config().tasksFile());
            document.put("feature", document.requireTag("feature").withTasks(
                    List.of(document.tasksFor("feature").get(0).withTitle("Changed")), "2026-01-06T00:00:00Z"));
            store.save(tags.config().tasksFile(), document);

            TaggedDocument reloaded = store.load(tags.config().tasksFile());
            Assertions.assertEquals("Original", reloaded.tasksFor("master").get(0).title());
            Assertions.assertEquals(TaskStatus.PENDING, reloaded.tasksFor("master").get(0).status());
            Assertions.assertEquals("Changed", reloaded.tasksFor("feature").get(0).title());
            Assertions.assertEquals(TaskStatus.DONE, reloaded.tasksFor("feature").get(0).status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void createFromMissingSourceMakesAnEmptyTag() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-tag-missing-source-");
        try {
            TagContext tags = context(root, VcsProbe.NONE);
            TagContext.TagCreated created = tags.createTag("empty-one", new TagContext.CreateOptions(false, "ghost", null));

            Assertions.assertEquals(0, created.tasksCopied());
            Assertions.assertNull(created.sourceTag());
            Assertions.assertEquals("Tag created on 2026-01-05", created.description());
            Assertions.assertThrows(ValidationException.class, () -> tags.createTag("empty-one", null));
            Assertions.assertThrows(ReservedNameException.class, () -> tags.createTag("Default", null));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void masterCanNeverBeDeleted() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-tag-delete-master-");
        try {
            TagContext tags = context(root, VcsProbe.NONE);
            Assertions.assertThrows(ValidationException.class, () -> tags.deleteTag("master", true, null));
            Assertions.assertThrows(ValidationException.class, () -> tags.deleteTag("master", false, DeletionConfirmer.DECLINE));
            Assertions.assertThrows(NotFoundException.class, () -> tags.deleteTag("ghost", true, null));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deletingTheActiveTagSwitchesToMaster() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-tag-delete-active-");
        try {
            TagContext tags = context(root, VcsProbe.NONE);
            tags.createTag("feature", null);
            tags.useTag("feature");
            Assertions.assertEquals("feature", tags.resolveCurrentTag());

            TagContext.TagDeleted deleted = tags.deleteTag("feature", false, DeletionConfirmer.DECLINE);

            Assertions.assertTrue(deleted.wasCurrentTag());
            Assertions.assertEquals("master", deleted.switchedTo());
            Assertions.assertEquals("master", tags.resolveCurrentTag());
            Assertions.assertEquals("master", new StateStore(tags.config().stateFile()).read().currentTag());
            Assertions.assertFalse(new TaskDocumentStore(CLOCK).load(tags.config().tasksFile()).contains("feature"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void nonEmptyTagNeedsBothConfirmationsUnlessForced() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-tag-delete-confirm-");
        try {
            TagContext tags = context(root, VcsProbe.NONE);
            tags.createTag("feature", null);
            new TaskOperations(tags, "feature", CLOCK).addTask(TaskContent.titled("Work"), null, null);

            Assertions.assertThrows(ConfirmationDeclinedException.class,
                    () -> tags.deleteTag("feature", false, DeletionConfirmer.DECLINE));
            Assertions.assertThrows(ConfirmationDeclinedException.class,
                    () -> tags.deleteTag("feature", false, new ScriptedConfirmer(true, "featur")));
            Assertions.assertTrue(new TaskDocumentStore(CLOCK).load(tags.config().tasksFile()).contains("feature"));

            TagContext.TagDeleted deleted = tags.deleteTag("feature", false, new ScriptedConfirmer(true, "feature"));
            Assertions.assertEquals(1, deleted.tasksDeleted());
            Assertions.assertFalse(deleted.wasCurrentTag());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deleteTagsIsAllOrNothing() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-tag-delete-many-");
        try {
            TagContext tags = context(root, VcsProbe.NONE);
            tags.createTag("a", null);
            tags.createTag("b", null);

            Assertions.assertThrows(NotFoundException.class, () -> tags.deleteTags(List.of("a", "ghost"), true, null));
            Assertions.assertTrue(new TaskDocumentStore(CLOCK).load(tags.config().tasksFile()).contains("a"));

            TagContext.TagsDeleted deleted = tags.deleteTags(List.of("a", "b", "a"), true, null);
            Assertions.assertEquals(2, deleted.deleted().size());
            Assertions.assertEquals(List.of("master"), new TaskDocumentStore(CLOCK).load(tags.config().tasksFile()).tagNames());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void renameToExistingNameChangesNothing() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-tag-rename-conflict-");
        try {
            TagContext tags = context(root, VcsProbe.NONE);
            tags.createTag("a", new TagContext.CreateOptions(false, null, "first"));
            tags.createTag("b", new TagContext.CreateOptions(false, null, "second"));
            TaggedDocument before = new TaskDocumentStore(CLOCK).load(tags.config().tasksFile());

            Assertions.assertThrows(ValidationException.class, () -> tags.renameTag("a", "b"));
            Assertions.assertThrows(ValidationException.class, () -> tags.renameTag("master", "trunk"));
            Assertions.assertThrows(ReservedNameException.class, () -> tags.renameTag("a", "main"));

            Assertions.assertEquals(before, new TaskDocumentStore(CLOCK).load(tags.config().tasksFile()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void renamingTheActiveTagMovesCurrentTagAndBranchMapping() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-tag-rename-active-");
        try {
            TagContext tags = context(root, VcsProbe.NONE);
            tags.createTag("old-name", null);
            tags.useTag("old-name");
            tags.updateBranchMapping("feature/x", "old-name");

            TagContext.TagRenamed renamed = tags.renameTag("old-name", "new-name");

            Assertions.assertTrue(renamed.wasCurrentTag());
            Assertions.assertEquals("new-name", tags.resolveCurrentTag());
            Assertions.assertEquals(Optional.of("new-name"), tags.getTagForBranch("feature/x"));
            TaggedDocument document = new TaskDocumentStore(CLOCK).load(tags.config().tasksFile());
            Assertions.assertEquals(List.of("master", "new-name"), document.tagNames());
            Assertions.assertEquals("old-name", document.requireTag("new-name").metadata().renamed().from());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void copyTagRecordsItsSource() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-tag-copy-");
        try {
            TagContext tags = context(root, VcsProbe.NONE);
            new TaskOperations(tags, null, CLOCK).addTask(TaskContent.titled("One"), null, null);

            TagContext.TagCopied copied = tags.copyTag("master", "snapshot", null);

            Assertions.assertEquals(1, copied.tasksCopied());
            Assertions.assertEquals("Copy of \"master\" created on 2026-01-05", copied.description());
            TaggedDocument document = new TaskDocumentStore(CLOCK).load(tags.config().tasksFile());
            Assertions.assertEquals("master", document.requireTag("snapshot").metadata().copiedFrom().tag());
            Assertions.assertThrows(NotFoundException.class, () -> tags.copyTag("ghost", "other", null));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void useTagReportsPreviousTagAndNextTask() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-tag-use-");
        try {
            TagContext tags = context(root, VcsProbe.NONE);
            tags.createTag("feature", null);
            new TaskOperations(tags, "feature", CLOCK).addTask(TaskContent.titled("Start here"), List.of(), null);

            TagContext.TagSwitched switched = tags.useTag("feature");

            Assertions.assertEquals("master", switched.previousTag());
            Assertions.assertEquals("feature", switched.currentTag());
            Assertions.assertEquals(1, switched.taskCount());
            Assertions.assertEquals("Start here", switched.nextTask().title());
            Assertions.assertThrows(NotFoundException.class, () -> tags.useTag("ghost"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void listPutsCurrentTagFirstAndBackfillsMetadata() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-tag-list-");
        try {
            TaskMeshConfig config = TaskMeshConfig.fromRoot(root.toString());
            writeTasks(config, "{\"master\":{\"tasks\":[]},"
                    + "\"zeta\":{\"tasks\":[]},"
                    + "\"alpha\":{\"tasks\":[{\"id\":1,\"title\":\"x\",\"status\":\"done\"},{\"id\":2,\"title\":\"y\"}]}}");
            TagContext tags = context(root, VcsProbe.NONE);
            tags.useTag("zeta");

            TagContext.TagListing listing = tags.listTags(true);

            Assertions.assertEquals("zeta", listing.currentTag());
            Assertions.assertEquals(3, listing.totalTags());
            Assertions.assertEquals(List.of("zeta", "alpha", "master"),
                    listing.tags().stream().map(TagContext.TagSummary::name).toList());
            TagContext.TagSummary alpha = listing.tags().get(1);
            Assertions.assertEquals(2, alpha.taskCount());
            Assertions.assertEquals(1L, alpha.completedTasks());

            JsonNode saved = Jsons.mapper().readTree(config.tasksFile().toFile());
            Assertions.assertEquals("2026-01-05T10:00:00Z", saved.path("alpha").path("metadata").path("created").asText());
            Assertions.assertEquals(TaggedDocument.MASTER_DESCRIPTION, saved.path("master").path("metadata").path("description").asText());
            Assertions.assertNull(tags.listTags(false).tags().get(0).metadata());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void currentTagResolutionPrecedence() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-tag-resolve-");
        try {
            TaskMeshConfig config = TaskMeshConfig.fromRoot(root.toString());
            Assertions.assertEquals("master", context(root, VcsProbe.NONE).resolveCurrentTag());

            Files.createDirectories(config.taskmasterDir());
            Files.writeString(config.configFile(), "{\"global\":{\"defaultTag\":\"team\"}}", StandardCharsets.UTF_8);
            TagContext tags = context(root, VcsProbe.NONE);
            Assertions.assertEquals("team", tags.resolveCurrentTag());
            Assertions.assertEquals("override", tags.resolveCurrentTag("override"));

            new StateStore(config.stateFile()).write(
                    new StateStore(config.stateFile()).read().switchedTo("stored", "2026-01-05T10:00:00Z"));
            Assertions.assertEquals("stored", tags.resolveCurrentTag());

            Files.writeString(config.stateFile(), "not json", StandardCharsets.UTF_8);
            Assertions.assertEquals("team", tags.resolveCurrentTag());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void branchSwitchingCreatesThenReusesTheBranchTag() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-tag-branch-");
        try {
            FakeVcs vcs = new FakeVcs(true, "feature/Login-Page");
            TagContext tags = context(root, vcs);

            TagContext.AutoSwitchOutcome missing = tags.autoSwitchForBranch(false, false);
            Assertions.assertFalse(missing.switched());
            Assertions.assertEquals("tag_not_found", missing.reason());
            Assertions.assertEquals("feature-login-page", missing.tagName());

            TagContext.AutoSwitchOutcome created = tags.autoSwitchForBranch(true, false);
            Assertions.assertTrue(created.switched());
            Assertions.assertTrue(created.created());
            Assertions.assertEquals("feature-login-page", tags.resolveCurrentTag());
            Assertions.assertEquals(Optional.of("feature-login-page"), tags.getTagForBranch("feature/Login-Page"));

            tags.useTag("master");
            TagContext.AutoSwitchOutcome reused = tags.switchBranchTag("feature/Login-Page");
            Assertions.assertTrue(reused.switched());
            Assertions.assertFalse(reused.created());
            Assertions.assertEquals("master", reused.previousTag());
            Assertions.assertEquals("feature-login-page", tags.resolveCurrentTag());

            vcs.branch = "main";
            Assertions.assertEquals("invalid_branch_for_tag", tags.autoSwitchForBranch(true, false).reason());
            Assertions.assertThrows(ValidationException.class, () -> tags.createTagFromBranch("develop", null));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void branchOperationsDoNothingOutsideARepository() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-tag-no-vcs-");
        try {
            TagContext tags = context(root, new FakeVcs(false, "feature/x"));

            TagContext.AutoSwitchOutcome outcome = tags.autoSwitchForBranch(true, true);
            Assertions.assertFalse(outcome.switched());
            Assertions.assertEquals("not_git_repo", outcome.reason());
            Assertions.assertEquals("not_git_repo", tags.switchBranchTag("feature/x").reason());
            Assertions.assertFalse(Files.exists(tags.config().stateFile()));
            Assertions.assertEquals(Optional.empty(), tags.getTagForBranch("feature/x"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void createTagFromBranchRecordsMappingAndCanSwitch() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-tag-from-branch-");
        try {
            TagContext tags = context(root, VcsProbe.NONE);
            TagContext.BranchTagCreated created = tags.createTagFromBranch("bugfix/JIRA-12 crash",
                    new TagContext.BranchTagOptions(false, null, null, true));

            Assertions.assertEquals("bugfix-jira-12-crash", created.tagName());
            Assertions.assertTrue(created.mappingUpdated());
            Assertions.assertTrue(created.autoSwitched());
            Assertions.assertEquals("Tag created from git branch \"bugfix/JIRA-12 crash\"", created.creation().description());
            Assertions.assertEquals("bugfix-jira-12-crash", tags.resolveCurrentTag());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void legacyLayoutNoticeIsRecordedOnce() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-tag-legacy-notice-");
        try {
            TaskMeshConfig config = TaskMeshConfig.fromRoot(root.toString());
            Files.createDirectories(config.legacyTasksFile().getParent());
            Files.writeString(config.legacyTasksFile(), "{\"tasks\":[{\"id\":1,\"title\":\"old\",\"dependencies\":[]}]}", StandardCharsets.UTF_8);
            TagContext tags = context(root, VcsProbe.NONE);

            Assertions.assertTrue(tags.acknowledgeLegacyLayout(true));
            Assertions.assertFalse(tags.acknowledgeLegacyLayout(true));
            Assertions.assertFalse(tags.acknowledgeLegacyLayout(false));
            Assertions.assertTrue(new StateStore(config.stateFile()).read().migrationNoticeShown());
        } finally {
            deleteRecursively(root);
        }
    }

    private static TagContext context(Path root, VcsProbe vcs) {
        return new TagContext(TaskMeshConfig.fromRoot(root.toString()), vcs, CLOCK);
    }

    private static void writeTasks(TaskMeshConfig config, String json) throws IOException {
        Files.createDirectories(config.tasksFile().getParent());
        Files.writeString(config.tasksFile(), json, StandardCharsets.UTF_8);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static final class FakeVcs implements VcsProbe {
        private final boolean repository;
        private String branch;

        private FakeVcs(boolean repository, String branch) {
            this.repository = repository;
            this.branch = branch;
        }

        @Override
        public boolean isRepository(Path projectRoot) {
            return repository;
        }

        @Override
        public Optional<String> currentBranch(Path projectRoot) {
            return Optional.ofNullable(branch);
        }
    }

    private record ScriptedConfirmer(boolean intent, String typedName) implements DeletionConfirmer {
        @Override
        public boolean confirmIntent(String tagName, int taskCount) {
            return intent;
        }

        @Override
        public String retypeName(String tagName) {
            return typedName;
        }
    }
}
