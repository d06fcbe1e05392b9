package com.ac.iisc.plandiff;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Minimal CLI entry for plan-stability checks.
 *
 * Usage:
 * - {@code compare [baselineDir targetDir]}: compare every case; directories
 *   default to {@code baseline_dir} / {@code target_dir} from config.properties.
 * - {@code export dir}: save each raw report in {@code dir} as a JSON plan.
 *
 * Exit status is 0 when every case matched, 1 on any difference or error,
 * 2 on bad usage.
 */
public class Main
{
    public static void main(String[] args)
    {
        System.exit(run(args));
    }

    static int run(String[] args)
    {
        String cmd = args.length == 0 ? "compare" : args[0];
        PlanRegression regression = new PlanRegression();
        try
        {
            switch (cmd) {
                case "compare": {
                    Path baseline = Paths.get(args.length > 2 ? args[1] : FileIO.getBaselineDir());
                    Path target = Paths.get(args.length > 2 ? args[2] : FileIO.getTargetDir());
                    return report(regression.compareDirectories(baseline, target));
                }
                case "export": {
                    if (args.length < 2) {
                        return usage();
                    }
                    int n = regression.exportBaselines(Paths.get(args[1]));
                    System.out.println("exported " + n + " plans into " + args[1]);
                    return 0;
                }
                default:
                    return usage();
            }
        }
        catch (Exception ex)
        {
            System.err.println("[Main] " + cmd + " failed: " + ex.getMessage());
            return 1;
        }
    }

    private static int report(List<PlanRegression.CaseResult> results)
    {
        int failures = 0;
        for (PlanRegression.CaseResult r : results) {
            switch (r.status()) {
                case SAME:
                    System.out.println(r.caseId() + ": same");
                    break;
                case DIFFERENT:
                    System.out.println(r.caseId() + ": DIFFERENT, " + r.detail());
                    failures++;
                    break;
                default:
                    System.out.println(r.caseId() + ": ERROR, " + r.detail());
                    failures++;
                    break;
            }
        }
        System.out.println(results.size() + " cases, " + failures + " not matching");
        return failures == 0 ? 0 : 1;
    }

    private static int usage()
    {
        System.err.println("usage: compare [baselineDir targetDir] | export dir");
        return 2;
    }
}
