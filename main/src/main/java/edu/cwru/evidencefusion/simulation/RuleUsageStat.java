package edu.cwru.evidencefusion.simulation;

import java.io.PrintStream;

import edu.cwru.evidencefusion.analysis.AnalysisResult;
import edu.cwru.evidencefusion.belief.RankedAlternative;
import edu.cwru.evidencefusion.combination.FoldStep;
import edu.cwru.evidencefusion.combination.RuleType;

/**
 * Accumulated statistics over many analysis runs at one conflict threshold.
 */
public class RuleUsageStat {

    private final double threshold;
    private int runs;
    private int dempsterSteps;
    private int yagerSteps;
    private double conflictSum;
    private double topScoreSum;
    private double topWidthSum;
    private double thetaMassSum;

    public RuleUsageStat(double threshold) {
        this.threshold = threshold;
    }

    public void record(AnalysisResult result) {
        runs++;
        for (FoldStep step : result.getTrace().allSteps()) {
            if (step.getRule() == RuleType.DEMPSTER)
                dempsterSteps++;
            else
                yagerSteps++;
            conflictSum += step.getConflict();
        }
        RankedAlternative top = result.getOptimal();
        topScoreSum += top.getScore();
        topWidthSum += top.getInterval().width();
        thetaMassSum += result.getGroupAssignment().mass(result.getGroupAssignment().getFrame().fullMask());
    }

    public void mergeResults(RuleUsageStat stat) {
        this.runs += stat.runs;
        this.dempsterSteps += stat.dempsterSteps;
        this.yagerSteps += stat.yagerSteps;
        this.conflictSum += stat.conflictSum;
        this.topScoreSum += stat.topScoreSum;
        this.topWidthSum += stat.topWidthSum;
        this.thetaMassSum += stat.thetaMassSum;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getRuns() {
        return runs;
    }

    public int getDempsterSteps() {
        return dempsterSteps;
    }

    public int getYagerSteps() {
        return yagerSteps;
    }

    public double yagerShare() {
        int steps = dempsterSteps + yagerSteps;
        return steps == 0 ? 0.0 : (double) yagerSteps / steps;
    }

    public double meanConflict() {
        int steps = dempsterSteps + yagerSteps;
        return steps == 0 ? 0.0 : conflictSum / steps;
    }

    public static void outputHeader(PrintStream out) {
        out.println("Threshold,Runs,Dempster Steps,Yager Steps,Yager Share,Mean Conflict,Mean Top Score,"
                + "Mean Top Width,Mean Theta Mass");
    }

    public void outputSummaryStat(PrintStream out) {
        out.println(threshold + "," + runs + "," + dempsterSteps + "," + yagerSteps + "," + yagerShare() + ","
                + meanConflict() + "," + topScoreSum / runs + "," + topWidthSum / runs + "," + thetaMassSum / runs);
    }
}
