package com.vidnyan.storygraph.application.service;

import com.vidnyan.storygraph.StoryGraphProperties;
import com.vidnyan.storygraph.application.port.in.AnalyzeScriptUseCase.AnalysisResult;
import com.vidnyan.storygraph.application.port.in.LayoutUseCase;
import com.vidnyan.storygraph.domain.layout.LabelGraphLayout;
import com.vidnyan.storygraph.domain.layout.LayeredLayout;
import com.vidnyan.storygraph.domain.layout.Position;
import com.vidnyan.storygraph.domain.layout.UnitBox;
import com.vidnyan.storygraph.domain.model.UnitLink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Applies the layout engines with the configured spacing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LayoutService implements LayoutUseCase {

    private final StoryGraphProperties properties;

    @Override
    public List<UnitBox> layoutUnits(List<UnitBox> boxes, List<UnitLink> links) {
        StoryGraphProperties.Layout settings = properties.getLayout();
        List<UnitBox> sized = boxes.stream()
                .map(b -> new UnitBox(
                        b.id(),
                        b.width() > 0 ? b.width() : settings.getDefaultWidth(),
                        b.height() > 0 ? b.height() : settings.getDefaultHeight(),
                        b.position() != null ? b.position() : Position.ORIGIN))
                .toList();

        LayeredLayout layout = new LayeredLayout(settings.getHorizontalPadding(), settings.getVerticalPadding());
        List<UnitBox> result = layout.layout(sized, links);
        log.info("Laid out {} units across {} links", result.size(), links.size());
        return result;
    }

    @Override
    public Map<String, Position> layoutRoutes(AnalysisResult result) {
        StoryGraphProperties.Layout settings = properties.getLayout();
        LabelGraphLayout layout = new LabelGraphLayout(settings.getRouteColumnSpacing(), settings.getRouteRowSpacing());
        Map<String, Position> positions = layout.layout(result.labelNodes(), result.routeEdges());
        log.info("Laid out {} label nodes", positions.size());
        return positions;
    }
}
