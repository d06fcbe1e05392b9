package com.ac.iisc.plandiff;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Plan-stability check across a version upgrade, driven by two directories of
 * cases (see {@link FileIO} for the file naming convention).
 *
 * Each case in the baseline directory is loaded from both directories and the
 * two plans are compared with {@link PlanComparator}. A case that cannot be
 * read or parsed is reported as {@link Status#ERROR} and does not stop the run.
 */
public class PlanRegression
{
    public enum Status { SAME, DIFFERENT, ERROR }

    /** Outcome of one case; {@code detail} is the comparison reason or the error message. */
    public record CaseResult(String caseId, Status status, String detail) {}

    private final String sqlSuffix;
    private final String explainSuffix;
    private final String jsonSuffix;

    /** Suffixes from {@code config.properties}. */
    public PlanRegression() {
        this(FileIO.getSqlSuffix(), FileIO.getExplainSuffix(), FileIO.getJsonSuffix());
    }

    public PlanRegression(String sqlSuffix, String explainSuffix, String jsonSuffix) {
        this.sqlSuffix = sqlSuffix;
        this.explainSuffix = explainSuffix;
        this.jsonSuffix = jsonSuffix;
    }

    /** Case ids present in {@code dir}, as report pairs or saved JSON plans. */
    public List<String> listCaseIds(Path dir) throws IOException {
        return FileIO.listFileStems(dir, explainSuffix, jsonSuffix);
    }

    /**
     * Load one case. A saved JSON plan takes precedence over a raw report.
     *
     * @throws IOException if neither form of the case can be read
     * @throws PlanParseException if the stored report or JSON is malformed
     */
    public Plan loadPlan(Path dir, String caseId) throws IOException, PlanParseException {
        Path json = dir.resolve(caseId + jsonSuffix);
        if (Files.isRegularFile(json)) {
            return PlanJson.fromJson(FileIO.readTextFile(json));
        }
        String sql = FileIO.readTextFile(dir.resolve(caseId + sqlSuffix));
        String explain = FileIO.readTextFile(dir.resolve(caseId + explainSuffix));
        return PlanParser.parseText(sql, explain);
    }

    /** Compare every baseline case against the case of the same id in {@code targetDir}. */
    public List<CaseResult> compareDirectories(Path baselineDir, Path targetDir) throws IOException {
        List<CaseResult> results = new ArrayList<>();
        for (String caseId : listCaseIds(baselineDir)) {
            results.add(compareCase(baselineDir, targetDir, caseId));
        }
        return results;
    }

    private CaseResult compareCase(Path baselineDir, Path targetDir, String caseId) {
        Plan baseline;
        Plan target;
        try {
            baseline = loadPlan(baselineDir, caseId);
            target = loadPlan(targetDir, caseId);
        } catch (IOException | PlanParseException ex) {
            System.err.println("[PlanRegression] Warning: case '" + caseId + "' skipped: " + ex.getMessage());
            return new CaseResult(caseId, Status.ERROR, ex.getMessage());
        }
        PlanComparison cmp = PlanComparator.compare(baseline, target);
        return new CaseResult(caseId, cmp.same() ? Status.SAME : Status.DIFFERENT, cmp.reason());
    }

    /**
     * Parse every raw report in {@code dir} and save it next to the report as
     * a JSON plan, so the directory can serve as a baseline later.
     *
     * @return number of plans written
     */
    public int exportBaselines(Path dir) throws IOException, PlanParseException {
        int written = 0;
        for (String caseId : FileIO.listFileStems(dir, explainSuffix)) {
            String sql = FileIO.readTextFile(dir.resolve(caseId + sqlSuffix));
            String explain = FileIO.readTextFile(dir.resolve(caseId + explainSuffix));
            Plan plan = PlanParser.parseText(sql, explain);
            FileIO.writeTextFile(dir.resolve(caseId + jsonSuffix), PlanJson.toJson(plan));
            written++;
        }
        return written;
    }
}
