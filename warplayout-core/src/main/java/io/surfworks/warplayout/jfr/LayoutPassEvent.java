package io.surfworks.warplayout.jfr;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event recording one run of the layout conversion removal pass.
 *
 * <p>The event duration spans the whole run, so it measures pass time as well.
 *
 * <p>Usage:
 * <pre>{@code
 * LayoutPassEvent event = new LayoutPassEvent();
 * event.begin();
 * // ... run the pass ...
 * event.moduleName = module.name();
 * event.conversionsBefore = 12;
 * event.conversionsAfter = 3;
 * event.success = true;
 * event.commit();
 * }</pre>
 */
@Name("io.surfworks.warplayout.LayoutPass")
@Label("Layout Conversion Removal")
@Category({"WarpLayout", "Compiler", "Pass"})
@Description("Records one run of the layout conversion removal pass over a module")
public class LayoutPassEvent extends Event {

    @Label("Module")
    @Description("Name of the module the pass ran on")
    public String moduleName;

    @Label("Functions")
    @Description("Number of functions analyzed and rewritten")
    public int functions;

    @Label("Anchors")
    @Description("Number of anchor values found over all functions")
    public int anchors;

    @Label("Conversions Before")
    @Description("Number of layout conversions in the input")
    public int conversionsBefore;

    @Label("Conversions After")
    @Description("Number of layout conversions in the output")
    public int conversionsAfter;

    @Label("Rematerialized")
    @Description("Conversions removed by recomputing their source in the target layout")
    public int rematerialized;

    @Label("Hoisted")
    @Description("Conversions moved above a widening cast or broadcast")
    public int hoisted;

    @Label("Decomposed")
    @Description("Dot accumulators split out of the accelerator layout")
    public int decomposed;

    @Label("Success")
    @Description("Whether every stage of the pass completed")
    public boolean success;

    @Label("Failed Stage")
    @Description("Name of the stage that failed (null on success)")
    public String failedStage;
}
