package de.bycsitsm.dispatch.calendar.ui;

import com.vaadin.flow.component.button.Button;
import com.vaadin.flow.component.button.ButtonVariant;
import com.vaadin.flow.component.checkbox.CheckboxGroup;
import com.vaadin.flow.component.combobox.MultiSelectComboBox;
import com.vaadin.flow.component.datepicker.DatePicker;
import com.vaadin.flow.component.grid.Grid;
import com.vaadin.flow.component.html.Span;
import com.vaadin.flow.component.icon.VaadinIcon;
import com.vaadin.flow.component.notification.Notification;
import com.vaadin.flow.component.notification.NotificationVariant;
import com.vaadin.flow.component.orderedlayout.FlexComponent;
import com.vaadin.flow.component.orderedlayout.HorizontalLayout;
import com.vaadin.flow.component.orderedlayout.VerticalLayout;
import com.vaadin.flow.data.renderer.LitRenderer;
import com.vaadin.flow.router.Menu;
import com.vaadin.flow.router.PageTitle;
import com.vaadin.flow.router.Route;
import de.bycsitsm.base.ui.ViewToolbar;
import de.bycsitsm.dispatch.calendar.AggregationResult;
import de.bycsitsm.dispatch.calendar.CalendarProperties;
import de.bycsitsm.dispatch.calendar.CalendarQuery;
import de.bycsitsm.dispatch.calendar.CalendarQueryException;
import de.bycsitsm.dispatch.calendar.CalendarService;
import de.bycsitsm.dispatch.calendar.DateRange;
import de.bycsitsm.dispatch.calendar.Event;
import de.bycsitsm.dispatch.calendar.EventType;
import de.bycsitsm.dispatch.directory.Team;
import de.bycsitsm.dispatch.directory.Worker;
import de.bycsitsm.dispatch.fieldservice.ExternalAdministrator;
import de.bycsitsm.dispatch.fieldservice.ExternalTeam;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Combined calendar of an organization: one chronological list of work-item
 * due dates, leave, public holidays, calendar blocks and field-service tasks,
 * filterable by workers, teams and sources.
 * <p>
 * Sources that cannot be read are reported as warnings; the events of the
 * other sources are still shown.
 */
@Route("")
@PageTitle("Dispatch Calendar")
@Menu(order = 0, icon = "vaadin:calendar", title = "Calendar")
class CombinedCalendarView extends VerticalLayout {

    private static final Logger log = LoggerFactory.getLogger(CombinedCalendarView.class);

    private static final DateTimeFormatter DATE_TIME_FORMATTER =
            DateTimeFormatter.ofPattern("EEE, MMM d HH:mm", Locale.US);
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("EEE, MMM d", Locale.US);

    private final CalendarService calendarService;
    private final long organizationId;

    private final DatePicker startPicker;
    private final DatePicker endPicker;
    private final CheckboxGroup<EventType> sourceSelect;
    private final MultiSelectComboBox<Worker> workerSelect;
    private final MultiSelectComboBox<Team> teamSelect;
    private final MultiSelectComboBox<ExternalAdministrator> externalAdminSelect;
    private final MultiSelectComboBox<ExternalTeam> externalTeamSelect;
    private final Grid<Event> grid;
    private final Span summary;

    CombinedCalendarView(CalendarService calendarService, CalendarProperties calendarProperties, Clock clock) {
        this.calendarService = calendarService;
        this.organizationId = calendarProperties.organizationId();

        setSizeFull();
        setPadding(false);
        setSpacing(false);

        var refreshButton = new Button("Reload directory", VaadinIcon.REFRESH.create(), event -> reloadDirectory());
        refreshButton.addThemeVariants(ButtonVariant.LUMO_TERTIARY);
        refreshButton.setTooltipText("Fetch field-service teams and administrators again");
        add(new ViewToolbar("Calendar", ViewToolbar.group(refreshButton)));

        var content = new VerticalLayout();
        content.setPadding(true);
        content.setSpacing(true);
        content.setSizeFull();

        var monday = LocalDate.now(clock).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        startPicker = new DatePicker("From", monday);
        endPicker = new DatePicker("To", monday.plusDays(6));

        sourceSelect = new CheckboxGroup<>("Sources");
        sourceSelect.setItems(EventType.values());
        sourceSelect.setItemLabelGenerator(CombinedCalendarView::sourceLabel);
        sourceSelect.select(EventType.values());

        var showButton = new Button("Show", VaadinIcon.SEARCH.create(), event -> loadEvents());
        showButton.addThemeVariants(ButtonVariant.LUMO_PRIMARY);

        var rangeBar = new HorizontalLayout(startPicker, endPicker, sourceSelect, showButton);
        rangeBar.setDefaultVerticalComponentAlignment(FlexComponent.Alignment.BASELINE);
        rangeBar.setWidthFull();
        content.add(rangeBar);

        workerSelect = new MultiSelectComboBox<>("Workers");
        workerSelect.setItemLabelGenerator(Worker::displayName);
        teamSelect = new MultiSelectComboBox<>("Teams");
        teamSelect.setItemLabelGenerator(Team::name);
        externalAdminSelect = new MultiSelectComboBox<>("Field-service administrators");
        externalAdminSelect.setItemLabelGenerator(ExternalAdministrator::displayName);
        externalTeamSelect = new MultiSelectComboBox<>("Field-service teams");
        externalTeamSelect.setItemLabelGenerator(ExternalTeam::title);

        var filterBar = new HorizontalLayout(workerSelect, teamSelect, externalAdminSelect, externalTeamSelect);
        filterBar.setWidthFull();
        filterBar.getChildren().forEach(component -> filterBar.setFlexGrow(1, component));
        content.add(filterBar);

        summary = new Span();
        summary.getStyle()
                .set("color", "var(--lumo-secondary-text-color)")
                .set("font-size", "var(--lumo-font-size-s)");
        content.add(summary);

        grid = createGrid();
        content.add(grid);
        content.setFlexGrow(1, grid);

        add(content);

        loadFilterOptions();
        loadEvents();
    }

    private Grid<Event> createGrid() {
        var eventGrid = new Grid<Event>();
        eventGrid.setSizeFull();
        eventGrid.setSelectionMode(Grid.SelectionMode.NONE);

        eventGrid.addColumn(LitRenderer.<Event>of(
                                "<span style=\"display:inline-block;width:0.75em;height:0.75em;border-radius:50%;"
                                        + "background:${item.color};margin-right:0.5em\"></span>${item.label}")
                        .withProperty("color", Event::color)
                        .withProperty("label", event -> sourceLabel(event.type())))
                .setHeader("Source")
                .setAutoWidth(true)
                .setFlexGrow(0);
        eventGrid.addColumn(CombinedCalendarView::formatStart)
                .setHeader("Start")
                .setAutoWidth(true)
                .setFlexGrow(0);
        eventGrid.addColumn(CombinedCalendarView::formatEnd)
                .setHeader("End")
                .setAutoWidth(true)
                .setFlexGrow(0);
        eventGrid.addColumn(Event::title)
                .setHeader("Title")
                .setFlexGrow(1);
        eventGrid.addColumn(event -> event.ownerName() != null ? event.ownerName() : "")
                .setHeader("Owner")
                .setAutoWidth(true);
        eventGrid.addColumn(event -> event.status() != null ? event.status() : "")
                .setHeader("Status")
                .setAutoWidth(true);
        return eventGrid;
    }

    private void loadFilterOptions() {
        var options = calendarService.filterOptions(organizationId);
        workerSelect.setItems(options.workers());
        teamSelect.setItems(options.teams());
        externalAdminSelect.setItems(options.externalAdministrators());
        externalTeamSelect.setItems(options.externalTeams());

        var externalError = options.externalError();
        externalAdminSelect.setEnabled(externalError == null);
        externalTeamSelect.setEnabled(externalError == null);
        if (externalError != null) {
            externalAdminSelect.setHelperText("Unavailable: " + externalError);
        }
    }

    private void reloadDirectory() {
        calendarService.refreshExternalDirectory();
        loadFilterOptions();
        Notification.show("Field-service directory reloaded", 3000, Notification.Position.BOTTOM_CENTER)
                .addThemeVariants(NotificationVariant.LUMO_SUCCESS);
    }

    private void loadEvents() {
        try {
            var query = new CalendarQuery(
                    organizationId,
                    DateRange.of(startPicker.getValue(), endPicker.getValue()),
                    ids(workerSelect.getSelectedItems(), Worker::id),
                    ids(teamSelect.getSelectedItems(), Team::id),
                    ids(externalAdminSelect.getSelectedItems(), ExternalAdministrator::id),
                    ids(externalTeamSelect.getSelectedItems(), ExternalTeam::id),
                    sourceSelect.getSelectedItems().isEmpty()
                            ? EnumSet.allOf(EventType.class)
                            : EnumSet.copyOf(sourceSelect.getSelectedItems()));
            var result = calendarService.combined(query);
            grid.setItems(result.events());
            updateSummary(result);
            showSourceErrors(result);
        } catch (CalendarQueryException e) {
            log.debug("Rejected calendar query: {}", e.getMessage());
            grid.setItems(List.of());
            summary.setText("");
            Notification.show(e.getMessage(), 5000, Notification.Position.MIDDLE)
                    .addThemeVariants(NotificationVariant.LUMO_ERROR);
        }
    }

    private void updateSummary(AggregationResult result) {
        var metadata = result.metadata();
        var perSource = metadata.counts().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(entry -> sourceLabel(entry.getKey()) + ": " + entry.getValue())
                .collect(Collectors.joining(", "));
        summary.setText(metadata.totalEvents() + " event(s) from " + metadata.range().start().format(DATE_FORMATTER)
                + " to " + metadata.range().end().format(DATE_FORMATTER)
                + (perSource.isEmpty() ? "" : " (" + perSource + ")"));
    }

    private static void showSourceErrors(AggregationResult result) {
        result.metadata().errors().forEach((source, message) ->
                Notification.show(sourceLabel(source) + " could not be loaded: " + message,
                                5000, Notification.Position.BOTTOM_CENTER)
                        .addThemeVariants(NotificationVariant.LUMO_WARNING));
    }

    private static <T> Set<Long> ids(Set<T> items, Function<T, Long> idFunction) {
        return items.stream().map(idFunction).collect(Collectors.toSet());
    }

    private static String formatStart(Event event) {
        return event.allDay() ? event.start().format(DATE_FORMATTER) : event.start().format(DATE_TIME_FORMATTER);
    }

    private static String formatEnd(Event event) {
        return event.allDay() ? event.end().format(DATE_FORMATTER) : event.end().format(DATE_TIME_FORMATTER);
    }

    static String sourceLabel(EventType type) {
        return switch (type) {
            case EXTERNAL_TASK -> "Field-service task";
            case WORK_ITEM -> "Work item";
            case LEAVE -> "Leave";
            case PUBLIC_HOLIDAY -> "Public holiday";
            case BLOCK -> "Calendar block";
        };
    }
}
