package io.surfworks.warplayout.jfr;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event recording one stage of the layout conversion removal pass.
 *
 * <p>Usage:
 * <pre>{@code
 * LayoutStageEvent event = new LayoutStageEvent();
 * event.begin();
 * // ... run the stage ...
 * event.stage = "rematerialize";
 * event.scope = module.name();
 * event.conversionCount = 4;
 * event.commit();
 * }</pre>
 */
@Name("io.surfworks.warplayout.LayoutStage")
@Label("Layout Pass Stage")
@Category({"WarpLayout", "Compiler", "Pass"})
@Description("Records the duration and outcome of one stage of the layout pass")
public class LayoutStageEvent extends Event {

    @Label("Stage")
    @Description("Stage name: propagate, cleanup, rematerialize, hoist, decompose, final-cleanup")
    public String stage;

    @Label("Scope")
    @Description("Function name for per-function stages, module name otherwise")
    public String scope;

    @Label("Conversion Count")
    @Description("Number of layout conversions left in the scope after the stage")
    public int conversionCount;
}
