package com.vidnyan.storygraph.application.port.in;

import com.vidnyan.storygraph.application.port.in.AnalyzeScriptUseCase.AnalysisResult;
import com.vidnyan.storygraph.domain.layout.Position;
import com.vidnyan.storygraph.domain.layout.UnitBox;
import com.vidnyan.storygraph.domain.model.UnitLink;

import java.util.List;
import java.util.Map;

/**
 * Automatic diagram layout.
 */
public interface LayoutUseCase {

    /**
     * Lay out the unit graph left to right.
     * @param boxes Current canvas boxes; missing sizes get the configured default
     * @param links Unit links from an analysis result
     * @return Boxes in input order with new positions
     */
    List<UnitBox> layoutUnits(List<UnitBox> boxes, List<UnitLink> links);

    /**
     * Lay out the label nodes of the route diagram.
     */
    Map<String, Position> layoutRoutes(AnalysisResult result);
}
