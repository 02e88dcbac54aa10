package com.whereq.poolstat.classify;

import com.whereq.poolstat.model.Attributes;
import com.whereq.poolstat.model.JobClassification;
import com.whereq.poolstat.model.JobStatus;
import com.whereq.poolstat.model.StateRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps a job record to the rollups it counts towards.
 *
 * A job is counted under the global totals, its experiment, its experiment and user, its
 * subgroup path (when it has one) and its user, once for every status-specific counter suffix.
 */
public class JobClassifier {

    public static final String UNKNOWN = "unknown";
    public static final String DEFAULT_ACCOUNTING_GROUP = "group_unknown";
    public static final String IMPOSSIBLE = "impossible";

    /**
     * Matched-site value meaning "the generic facility"; such jobs are sited by resource name instead
     */
    public static final String DEFAULT_GENERIC_SITE = "FNAL";

    private static final Pattern GROUP_TOKEN = Pattern.compile("(?:group_)?(\\w+)");

    private final String genericSite;

    public JobClassifier() {
        this(DEFAULT_GENERIC_SITE);
    }

    public JobClassifier(String genericSite) {
        this.genericSite = Objects.requireNonNull(genericSite);
    }

    /**
     * Classify a job record. Never throws; unparseable fields fall back to "unknown".
     */
    public JobClassification classify(StateRecord job) {
        String user = job.string(Attributes.OWNER)
            .filter(owner -> !owner.isBlank())
            .orElse(UNKNOWN);

        List<String> groups = parseAccountingGroup(job.string(Attributes.ACCOUNTING_GROUP, DEFAULT_ACCOUNTING_GROUP));
        String experiment = groups.isEmpty() ? UNKNOWN : groups.get(0);
        List<String> subgroups = subgroups(groups, user);

        JobStatus status = JobStatus.of(job);
        List<String> suffixes = counterSuffixes(job, status);

        return JobClassification.builder()
            .experiment(experiment)
            .user(user)
            .subgroups(subgroups)
            .status(status)
            .counterSuffixes(suffixes)
            .metricPrefixes(expand(suffixes, experiment, user, subgroups))
            .build();
    }

    /**
     * Split an accounting group such as "group_atlas.prod.alice" into ["atlas", "prod", "alice"].
     * A trailing "@domain" is not part of the group path.
     */
    static List<String> parseAccountingGroup(String accountingGroup) {
        String path = accountingGroup;
        int at = path.indexOf('@');
        if (at >= 0) {
            path = path.substring(0, at);
        }

        List<String> tokens = new ArrayList<>();
        Matcher matcher = GROUP_TOKEN.matcher(path);
        while (matcher.find()) {
            tokens.add(matcher.group(1));
        }
        return tokens;
    }

    /**
     * Tokens after the experiment. A last token equal to the user is a per-user group and is dropped.
     */
    private static List<String> subgroups(List<String> groups, String user) {
        if (groups.size() <= 1) {
            return List.of();
        }
        if (groups.get(groups.size() - 1).equals(user)) {
            return List.copyOf(groups.subList(1, groups.size() - 1));
        }
        return List.copyOf(groups.subList(1, groups.size()));
    }

    private List<String> counterSuffixes(StateRecord job, JobStatus status) {
        List<String> suffixes = new ArrayList<>();
        suffixes.add("." + status.label() + ".totals");

        switch (status) {
            case IDLE -> suffixes.addAll(idleSuffixes(job));
            case RUNNING -> suffixes.add(".running.sites." + runningSite(job));
            default -> {
                // totals only
            }
        }
        return suffixes;
    }

    private List<String> idleSuffixes(StateRecord job) {
        if (!job.has(Attributes.DESIRED_USAGE_MODEL)) {
            return List.of(".idle.usage_models." + UNKNOWN);
        }

        List<String> suffixes = new ArrayList<>();
        for (String site : splitList(job.string(Attributes.DESIRED_SITES, ""))) {
            suffixes.add(".idle.sites." + site);
        }

        TreeSet<String> models = new TreeSet<>(splitList(job.string(Attributes.DESIRED_USAGE_MODEL, "")));
        String modelLabel = models.isEmpty() ? IMPOSSIBLE : String.join("_", models);
        suffixes.add(".idle.usage_models." + modelLabel);
        return suffixes;
    }

    private String runningSite(StateRecord job) {
        return job.string(Attributes.MATCH_SITE)
            .map(site -> {
                if (site.equals(genericSite)) {
                    return job.string(Attributes.MATCH_RESOURCE_NAME).orElse(site);
                }
                return site;
            })
            .orElse(UNKNOWN);
    }

    private static List<String> expand(List<String> suffixes, String experiment, String user, List<String> subgroups) {
        String subgroupPath = String.join(".", subgroups);
        List<String> metrics = new ArrayList<>();
        for (String suffix : suffixes) {
            metrics.add("totals" + suffix);
            metrics.add("experiments." + experiment + ".totals" + suffix);
            metrics.add("experiments." + experiment + ".users." + user + suffix);
            if (!subgroups.isEmpty()) {
                metrics.add("experiments." + experiment + ".subgroups." + subgroupPath + "." + suffix);
            }
            metrics.add("users." + user + suffix);
        }
        return metrics;
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(item -> !item.isEmpty())
            .collect(Collectors.toList());
    }
}
