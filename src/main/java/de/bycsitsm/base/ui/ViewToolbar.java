package de.bycsitsm.base.ui;

import com.vaadin.flow.component.Component;
import com.vaadin.flow.component.Composite;
import com.vaadin.flow.component.html.Div;
import com.vaadin.flow.component.html.H1;
import com.vaadin.flow.component.html.Header;
import com.vaadin.flow.theme.lumo.LumoUtility;
import org.jspecify.annotations.Nullable;

/**
 * Header bar shown at the top of every view: the view title on the left,
 * the given components on the right.
 */
public final class ViewToolbar extends Composite<Header> {

    public ViewToolbar(@Nullable String viewTitle, Component... components) {
        getContent().addClassNames(LumoUtility.Display.FLEX, LumoUtility.FlexDirection.ROW,
                LumoUtility.JustifyContent.BETWEEN, LumoUtility.AlignItems.CENTER, LumoUtility.Gap.MEDIUM,
                LumoUtility.Padding.MEDIUM);

        if (viewTitle != null) {
            var title = new H1(viewTitle);
            title.addClassNames(LumoUtility.FontSize.XLARGE, LumoUtility.Margin.NONE, LumoUtility.FontWeight.LIGHT);
            getContent().add(title);
        }

        if (components.length > 0) {
            var actions = new Div(components);
            actions.addClassNames(LumoUtility.Display.FLEX, LumoUtility.FlexWrap.WRAP, LumoUtility.Gap.SMALL,
                    LumoUtility.AlignItems.CENTER);
            getContent().add(actions);
        }
    }

    /**
     * Wraps components that belong together so they stay on one line.
     */
    public static Component group(Component... components) {
        var group = new Div(components);
        group.addClassNames(LumoUtility.Display.FLEX, LumoUtility.FlexDirection.ROW, LumoUtility.AlignItems.CENTER,
                LumoUtility.Gap.SMALL);
        return group;
    }
}
