package com.williamcallahan.codelab.domain.codelab;

import com.williamcallahan.codelab.support.AsciiTextNormalizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A parsed codelab: document metadata plus its ordered steps.
 *
 * <p>Built once by a parser, then frozen before it is returned to callers.</p>
 */
public class Codelab {

    private String id = "";
    private String title = "";
    private String authors = "";
    private String badgePath = "";
    private String summary = "";
    private String feedbackLink = "";
    private String analyticsAccount = "";
    private List<String> status = List.of();
    private int durationMinutes;
    private final SortedSet<String> categories = new TreeSet<>();
    private final SortedSet<String> tags = new TreeSet<>();
    private final List<Step> steps = new ArrayList<>();
    private final Map<String, String> extra = new LinkedHashMap<>();
    private boolean frozen;

    /**
     * Opens a new step at the end of the document.
     *
     * @param stepTitle title of the step
     * @return the new step
     */
    public Step newStep(String stepTitle) {
        requireMutable();
        Step step = new Step(stepTitle);
        steps.add(step);
        return step;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        requireMutable();
        this.id = Objects.requireNonNull(id, "Codelab id cannot be null");
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        requireMutable();
        this.title = Objects.requireNonNull(title, "Codelab title cannot be null");
    }

    public String getAuthors() {
        return authors;
    }

    public void setAuthors(String authors) {
        requireMutable();
        this.authors = authors;
    }

    public String getBadgePath() {
        return badgePath;
    }

    public void setBadgePath(String badgePath) {
        requireMutable();
        this.badgePath = badgePath;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        requireMutable();
        this.summary = summary;
    }

    public String getFeedbackLink() {
        return feedbackLink;
    }

    public void setFeedbackLink(String feedbackLink) {
        requireMutable();
        this.feedbackLink = feedbackLink;
    }

    public String getAnalyticsAccount() {
        return analyticsAccount;
    }

    public void setAnalyticsAccount(String analyticsAccount) {
        requireMutable();
        this.analyticsAccount = analyticsAccount;
    }

    public List<String> getStatus() {
        return status;
    }

    public void setStatus(List<String> status) {
        requireMutable();
        this.status = List.copyOf(status);
    }

    /**
     * Returns the total duration, the sum of the declared step durations.
     *
     * @return minutes
     */
    public int getDurationMinutes() {
        return durationMinutes;
    }

    public void setDurationMinutes(int durationMinutes) {
        requireMutable();
        this.durationMinutes = durationMinutes;
    }

    public SortedSet<String> getCategories() {
        return Collections.unmodifiableSortedSet(categories);
    }

    public void addCategories(Collection<String> newCategories) {
        requireMutable();
        addNormalized(categories, newCategories);
    }

    public SortedSet<String> getTags() {
        return Collections.unmodifiableSortedSet(tags);
    }

    public void addTags(Collection<String> newTags) {
        requireMutable();
        addNormalized(tags, newTags);
    }

    public List<Step> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    /**
     * Returns pass-through metadata that was explicitly allow-listed.
     *
     * @return extension map keyed by case-folded metadata key
     */
    public Map<String, String> getExtra() {
        return Collections.unmodifiableMap(extra);
    }

    public void putExtra(String key, String value) {
        requireMutable();
        extra.put(key, value);
    }

    /**
     * Rejects further mutation of the document and all of its steps.
     */
    public void freeze() {
        for (Step step : steps) {
            step.freeze();
        }
        frozen = true;
    }

    private void requireMutable() {
        if (frozen) {
            throw new IllegalStateException("Codelab '" + id + "' is finalized");
        }
    }

    private static void addNormalized(SortedSet<String> target, Collection<String> values) {
        for (String value : values) {
            String normalized = AsciiTextNormalizer.toLowerAscii(value).trim();
            if (!normalized.isEmpty()) {
                target.add(normalized);
            }
        }
    }
}
