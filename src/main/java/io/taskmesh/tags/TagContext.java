package io.taskmesh.tags;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.taskmesh.config.ProjectSettings;
import io.taskmesh.config.TaskMeshConfig;
import io.taskmesh.error.ConfirmationDeclinedException;
import io.taskmesh.error.ValidationException;
import io.taskmesh.model.Tag;
import io.taskmesh.model.TagMetadata;
import io.taskmesh.model.TaggedDocument;
import io.taskmesh.model.Task;
import io.taskmesh.model.TaskState;
import io.taskmesh.scheduler.NextTaskScheduler;
import io.taskmesh.storage.StateStore;
import io.taskmesh.storage.TaskDocumentStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Tag lifecycle and current-tag bookkeeping for one project. Every mutation loads the full
 * document, changes it in memory and saves it whole; side-state is written right after.
 */
public final class TagContext {
    private static final Logger logger = LogManager.getLogger(TagContext.class);

    private final TaskMeshConfig config;
    private final TaskDocumentStore store;
    private final StateStore stateStore;
    private final ProjectSettings settings;
    private final VcsProbe vcs;
    private final Clock clock;

    public TagContext(TaskMeshConfig config) {
        this(config, new GitCli(), Clock.systemUTC());
    }

    public TagContext(TaskMeshConfig config, VcsProbe vcs, Clock clock) {
        this(
                config,
                new TaskDocumentStore(clock),
                new StateStore(config.stateFile()),
                ProjectSettings.load(config.configFile()),
                vcs,
                clock
        );
    }

    public TagContext(
            TaskMeshConfig config,
            TaskDocumentStore store,
            StateStore stateStore,
            ProjectSettings settings,
            VcsProbe vcs,
            Clock clock
    ) {
        this.config = config;
        this.store = store;
        this.stateStore = stateStore;
        this.settings = settings;
        this.vcs = vcs == null ? VcsProbe.NONE : vcs;
        this.clock = clock;
    }

    public TaskMeshConfig config() {
        return config;
    }

    public ProjectSettings settings() {
        return settings;
    }

    public TaskDocumentStore store() {
        return store;
    }

    /**
     * The tag a command targets: the explicit override, else the stored current tag, else the
     * configured default, else {@value TaggedDocument#MASTER}. Never throws.
     */
    public String resolveCurrentTag(String override) {
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        String stored = stateStore.read().currentTag();
        if (stored != null && !stored.isBlank()) {
            return stored;
        }
        return settings.defaultTag();
    }

    public String resolveCurrentTag() {
        return resolveCurrentTag(null);
    }

    /**
     * Records that the user has been told about the pre-tag file layout. Returns true only the
     * first time a legacy file is seen.
     */
    public boolean acknowledgeLegacyLayout(boolean legacy) {
        if (!legacy) {
            return false;
        }
        TaskState state = stateStore.read();
        if (state.migrationNoticeShown()) {
            return false;
        }
        logger.info("{} uses the single-tag layout; it is read as tag \"{}\" and rewritten in tagged form on the next save",
                config.tasksFile(), TaggedDocument.MASTER);
        stateStore.write(state.withMigrationNoticeShown(true));
        return true;
    }

    public TagCreated createTag(String name, CreateOptions options) {
        CreateOptions opts = options == null ? CreateOptions.EMPTY : options;
        TagNames.requireValidNewName(name);
        Path file = config.tasksFile();
        TaggedDocument document = store.load(file);
        requireAbsent(document, name);

        String source = null;
        if (opts.copyFromTag() != null && !opts.copyFromTag().isBlank()) {
            source = opts.copyFromTag().trim();
        } else if (opts.copyFromCurrent()) {
            source = resolveCurrentTag();
        }
        List<Task> copied = List.of();
        if (source != null) {
            Optional<Tag> sourceTag = document.tag(source);
            if (sourceTag.isEmpty() || sourceTag.get().tasks().isEmpty()) {
                logger.warn("Source tag \"{}\" is missing or empty, creating \"{}\" without tasks", source, name);
                source = null;
            } else {
                copied = sourceTag.get().tasks();
            }
        }

        String description = isBlank(opts.description())
                ? "Tag created on " + today()
                : opts.description();
        document.put(name, new Tag(copied, TagMetadata.of(now(), description)));
        store.save(file, document);
        logger.info("Created tag \"{}\" with {} task(s)", name, copied.size());
        return new TagCreated(name, true, copied.size(), source, description);
    }

    public TagSwitched useTag(String name) {
        if (isBlank(name)) {
            throw new ValidationException("Tag name is required");
        }
        TaggedDocument document = store.load(config.tasksFile());
        Tag tag = document.requireTag(name);
        String previous = resolveCurrentTag();
        stateStore.write(stateStore.read().switchedTo(name, now()));
        Task next = NextTaskScheduler.findNextTask(tag.tasks()).orElse(null);
        logger.info("Switched from tag \"{}\" to \"{}\"", previous, name);
        return new TagSwitched(previous, name, tag.tasks().size(), next);
    }

    public TagRenamed renameTag(String oldName, String newName) {
        if (isBlank(oldName)) {
            throw new ValidationException("Current tag name is required");
        }
        if (TaggedDocument.MASTER.equals(oldName)) {
            throw new ValidationException("Cannot rename the \"master\" tag");
        }
        TagNames.requireValidNewName(newName);
        Path file = config.tasksFile();
        TaggedDocument document = store.load(file);
        Tag tag = document.requireTag(oldName);
        requireAbsent(document, newName);

        String now = now();
        TagMetadata meta = tag.metadata() == null ? TagMetadata.of(now, null) : tag.metadata();
        Tag renamed = tag.withMetadata(meta.withUpdated(now).withRenamed(new TagMetadata.Renamed(oldName, now)));
        document.rename(oldName, newName, renamed);
        store.save(file, document);

        TaskState state = stateStore.read();
        boolean wasCurrent = oldName.equals(resolveCurrentTag());
        TaskState updated = state.withTagRenamed(oldName, newName);
        if (wasCurrent && !newName.equals(updated.currentTag())) {
            updated = updated.switchedTo(newName, now);
        }
        if (!updated.equals(state)) {
            stateStore.write(updated);
        }
        logger.info("Renamed tag \"{}\" to \"{}\"", oldName, newName);
        return new TagRenamed(oldName, newName, tag.tasks().size(), wasCurrent);
    }

    public TagCopied copyTag(String sourceName, String targetName, String description) {
        if (isBlank(sourceName)) {
            throw new ValidationException("Source tag name is required");
        }
        TagNames.requireValidNewName(targetName);
        Path file = config.tasksFile();
        TaggedDocument document = store.load(file);
        Tag source = document.requireTag(sourceName);
        requireAbsent(document, targetName);

        String now = now();
        String desc = isBlank(description)
                ? "Copy of \"" + sourceName + "\" created on " + today()
                : description;
        TagMetadata meta = TagMetadata.of(now, desc).withCopiedFrom(new TagMetadata.CopiedFrom(sourceName, now));
        document.put(targetName, new Tag(source.tasks(), meta));
        store.save(file, document);
        logger.info("Copied tag \"{}\" to \"{}\" ({} task(s))", sourceName, targetName, source.tasks().size());
        return new TagCopied(sourceName, targetName, source.tasks().size(), desc);
    }

    public TagDeleted deleteTag(String name, boolean force, DeletionConfirmer confirmer) {
        return deleteTags(List.of(name), force, confirmer).deleted().get(0);
    }

    /**
     * Deletes every named tag or none. {@value TaggedDocument#MASTER} can never be deleted;
     * non-empty tags need both confirmation steps unless {@code force} is set. If the current
     * tag goes, side-state is switched to {@value TaggedDocument#MASTER} before returning.
     */
    public TagsDeleted deleteTags(List<String> names, boolean force, DeletionConfirmer confirmer) {
        if (names == null || names.isEmpty()) {
            throw new ValidationException("At least one tag name is required");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String name : names) {
            if (isBlank(name)) {
                throw new ValidationException("Tag name is required");
            }
            if (TaggedDocument.MASTER.equals(name.trim())) {
                throw new ValidationException("Cannot delete the \"master\" tag");
            }
            unique.add(name.trim());
        }
        Path file = config.tasksFile();
        TaggedDocument document = store.load(file);
        for (String name : unique) {
            document.requireTag(name);
        }
        if (!force) {
            DeletionConfirmer asker = confirmer == null ? DeletionConfirmer.DECLINE : confirmer;
            for (String name : unique) {
                int count = document.requireTag(name).tasks().size();
                if (count > 0) {
                    confirm(asker, name, count);
                }
            }
        }

        String current = resolveCurrentTag();
        List<TagDeleted> deleted = new ArrayList<>();
        for (String name : unique) {
            Tag removed = document.remove(name);
            boolean wasCurrent = name.equals(current);
            deleted.add(new TagDeleted(name, removed.tasks().size(), wasCurrent, wasCurrent ? TaggedDocument.MASTER : null));
        }
        store.save(file, document);
        if (unique.contains(current)) {
            stateStore.write(stateStore.read().switchedTo(TaggedDocument.MASTER, now()));
            logger.info("Deleted the current tag \"{}\", switched to \"{}\"", current, TaggedDocument.MASTER);
        }
        logger.info("Deleted tag(s) {}", unique);
        return new TagsDeleted(List.copyOf(deleted));
    }

    private static void confirm(DeletionConfirmer confirmer, String name, int taskCount) {
        if (!confirmer.confirmIntent(name, taskCount)) {
            throw new ConfirmationDeclinedException("Deletion of tag \"" + name + "\" cancelled");
        }
        if (!name.equals(confirmer.retypeName(name))) {
            throw new ConfirmationDeclinedException("Deletion of tag \"" + name + "\" cancelled: name did not match");
        }
    }

    /**
     * All tags with task counts, the current tag first and the rest by name. Tags missing
     * metadata get it filled in, and the document is saved if anything was filled.
     */
    public TagListing listTags(boolean showMetadata) {
        Path file = config.tasksFile();
        TaskDocumentStore.LoadedDocument loaded = store.load(file, TaggedDocument.MASTER);
        TaggedDocument document = loaded.document();
        String current = resolveCurrentTag();

        boolean backfilled = false;
        for (String name : document.tagNames()) {
            Tag tag = document.requireTag(name);
            TagMetadata filled = backfill(name, tag.metadata());
            if (!filled.equals(tag.metadata())) {
                document.put(name, tag.withMetadata(filled));
                backfilled = true;
            }
        }
        if (backfilled && loaded.existed()) {
            store.save(file, document);
            logger.debug("Filled in missing tag metadata in {}", file);
        }

        List<TagSummary> summaries = new ArrayList<>();
        for (String name : document.tagNames()) {
            Tag tag = document.requireTag(name);
            summaries.add(new TagSummary(
                    name,
                    name.equals(current),
                    tag.tasks().size(),
                    tag.completedCount(),
                    showMetadata ? tag.metadata() : null
            ));
        }
        summaries.sort(Comparator.comparing((TagSummary s) -> !s.current()).thenComparing(TagSummary::name));
        return new TagListing(current, summaries.size(), List.copyOf(summaries));
    }

    private TagMetadata backfill(String name, TagMetadata metadata) {
        TagMetadata meta = metadata == null ? new TagMetadata(null, null, null, null, null) : metadata;
        if (meta.created() == null) {
            meta = meta.withCreated(now());
        }
        if (meta.description() == null) {
            meta = meta.withDescription(TaggedDocument.MASTER.equals(name)
                    ? TaggedDocument.MASTER_DESCRIPTION
                    : "Tag created on " + today());
        }
        if (meta.updated() == null) {
            meta = meta.withUpdated(meta.created());
        }
        return meta;
    }

    public Optional<String> getTagForBranch(String branch) {
        if (isBlank(branch)) {
            return Optional.empty();
        }
        return Optional.ofNullable(stateStore.read().branchTagMapping().get(branch));
    }

    /**
     * Maps {@code branch} to {@code tag} in side-state. A write failure is logged and reported
     * as {@code false}; tag operations do not fail on it.
     */
    public boolean updateBranchMapping(String branch, String tag) {
        try {
            stateStore.write(stateStore.read().withBranchMapping(branch, tag));
            return true;
        } catch (UncheckedIOException e) {
            logger.warn("Could not update branch mapping {} -> {}: {}", branch, tag, e.getMessage());
            return false;
        }
    }

    public BranchTagCreated createTagFromBranch(String branch, BranchTagOptions options) {
        BranchTagOptions opts = options == null ? new BranchTagOptions(false, null, null, false) : options;
        if (!TagNames.isValidBranchForTag(branch)) {
            throw new ValidationException("Branch \"" + branch + "\" cannot be converted to a valid tag name");
        }
        String tagName = TagNames.sanitizeBranch(branch);
        logger.info("Creating tag \"{}\" from branch \"{}\"", tagName, branch);
        String description = isBlank(opts.description())
                ? "Tag created from git branch \"" + branch + "\""
                : opts.description();
        TagCreated created = createTag(tagName, new CreateOptions(opts.copyFromCurrent(), opts.copyFromTag(), description));
        boolean mapped = updateBranchMapping(branch, tagName);
        if (opts.autoSwitch()) {
            stateStore.write(stateStore.read().switchedTo(tagName, now()));
            logger.info("Switched to tag \"{}\"", tagName);
        }
        return new BranchTagCreated(branch, tagName, created, mapped, opts.autoSwitch());
    }

    /**
     * Switches to the tag mapped to {@code branch}, or to the tag named after it. Outside a
     * repository this does nothing.
     */
    public AutoSwitchOutcome switchBranchTag(String branch) {
        if (!vcs.isRepository(config.projectRoot())) {
            logger.debug("{} is not a repository, branch tags are off", config.projectRoot());
            return AutoSwitchOutcome.skipped("not_git_repo", branch);
        }
        return switchForBranch(branch, false, false);
    }

    public AutoSwitchOutcome autoSwitchForBranch(boolean createIfMissing, boolean copyFromCurrent) {
        Path root = config.projectRoot();
        if (!vcs.isRepository(root)) {
            logger.warn("Not in a git repository, cannot switch tags by branch");
            return AutoSwitchOutcome.skipped("not_git_repo", null);
        }
        Optional<String> branch = vcs.currentBranch(root);
        if (branch.isEmpty()) {
            logger.warn("Could not determine the current branch");
            return AutoSwitchOutcome.skipped("no_current_branch", null);
        }
        return switchForBranch(branch.get(), createIfMissing, copyFromCurrent);
    }

    private AutoSwitchOutcome switchForBranch(String branch, boolean createIfMissing, boolean copyFromCurrent) {
        if (!TagNames.isValidBranchForTag(branch)) {
            logger.info("Branch \"{}\" does not get its own tag", branch);
            return AutoSwitchOutcome.skipped("invalid_branch_for_tag", branch);
        }
        Optional<String> mapped = getTagForBranch(branch);
        String tagName = mapped.orElseGet(() -> TagNames.sanitizeBranch(branch));
        boolean exists = store.load(config.tasksFile()).contains(tagName);
        if (exists) {
            TagSwitched switched = useTag(tagName);
            if (mapped.isEmpty()) {
                updateBranchMapping(branch, tagName);
            }
            return new AutoSwitchOutcome(true, false, null, branch, tagName, switched.previousTag());
        }
        if (createIfMissing) {
            String previous = resolveCurrentTag();
            createTagFromBranch(branch, new BranchTagOptions(copyFromCurrent, null, null, true));
            return new AutoSwitchOutcome(true, true, null, branch, tagName, previous);
        }
        logger.warn("Tag \"{}\" for branch \"{}\" does not exist", tagName, branch);
        return new AutoSwitchOutcome(false, false, "tag_not_found", branch, tagName, null);
    }

    private static void requireAbsent(TaggedDocument document, String name) {
        if (document.contains(name)) {
            throw new ValidationException("Tag \"" + name + "\" already exists");
        }
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    private String today() {
        return LocalDate.now(clock).toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record CreateOptions(boolean copyFromCurrent, String copyFromTag, String description) {
        public static final CreateOptions EMPTY = new CreateOptions(false, null, null);
    }

    public record BranchTagOptions(boolean copyFromCurrent, String copyFromTag, String description, boolean autoSwitch) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TagCreated(String tagName, boolean created, int tasksCopied, String sourceTag, String description) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TagSwitched(String previousTag, String currentTag, int taskCount, Task nextTask) {
    }

    public record TagRenamed(String oldName, String newName, int taskCount, boolean wasCurrentTag) {
    }

    public record TagCopied(String sourceName, String targetName, int tasksCopied, String description) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TagDeleted(String tagName, int tasksDeleted, boolean wasCurrentTag, String switchedTo) {
    }

    public record TagsDeleted(List<TagDeleted> deleted) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TagSummary(String name, boolean current, int taskCount, long completedTasks, TagMetadata metadata) {
    }

    public record TagListing(String currentTag, int totalTags, List<TagSummary> tags) {
    }

    public record BranchTagCreated(String branchName, String tagName, TagCreated creation, boolean mappingUpdated, boolean autoSwitched) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AutoSwitchOutcome(
            boolean switched,
            boolean created,
            String reason,
            String branchName,
            String tagName,
            String previousTag
    ) {
        static AutoSwitchOutcome skipped(String reason, String branchName) {
            return new AutoSwitchOutcome(false, false, reason, branchName, null, null);
        }
    }
}
