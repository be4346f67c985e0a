package de.bycsitsm.dispatch.availability.ui;

import com.vaadin.flow.component.button.Button;
import com.vaadin.flow.component.button.ButtonVariant;
import com.vaadin.flow.component.combobox.ComboBox;
import com.vaadin.flow.component.datepicker.DatePicker;
import com.vaadin.flow.component.grid.Grid;
import com.vaadin.flow.component.html.Span;
import com.vaadin.flow.component.icon.VaadinIcon;
import com.vaadin.flow.component.notification.Notification;
import com.vaadin.flow.component.notification.NotificationVariant;
import com.vaadin.flow.component.orderedlayout.FlexComponent;
import com.vaadin.flow.component.orderedlayout.HorizontalLayout;
import com.vaadin.flow.component.orderedlayout.VerticalLayout;
import com.vaadin.flow.component.radiobutton.RadioButtonGroup;
import com.vaadin.flow.component.textfield.IntegerField;
import com.vaadin.flow.component.textfield.TextField;
import com.vaadin.flow.router.Menu;
import com.vaadin.flow.router.PageTitle;
import com.vaadin.flow.router.Route;
import de.bycsitsm.base.ui.ViewToolbar;
import de.bycsitsm.dispatch.availability.AvailabilityService;
import de.bycsitsm.dispatch.availability.BookingDuration;
import de.bycsitsm.dispatch.availability.Slot;
import de.bycsitsm.dispatch.calendar.CalendarProperties;
import de.bycsitsm.dispatch.calendar.CalendarQueryException;
import de.bycsitsm.dispatch.calendar.CalendarService;
import de.bycsitsm.dispatch.calendar.DateRange;
import de.bycsitsm.dispatch.directory.Team;
import de.bycsitsm.dispatch.directory.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Slot search: finds the times a worker or a team can take on a job of a given
 * length, including travel before and after.
 */
@Route("availability")
@PageTitle("Find a Slot")
@Menu(order = 1, icon = "vaadin:clock", title = "Find a Slot")
class AvailabilityView extends VerticalLayout {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityView.class);

    private static final String FOR_WORKER = "Worker";
    private static final String FOR_TEAM = "Team";

    private final AvailabilityService availabilityService;
    private final long organizationId;

    private final RadioButtonGroup<String> modeSelect;
    private final ComboBox<Worker> workerSelect;
    private final ComboBox<Team> teamSelect;
    private final DatePicker startPicker;
    private final DatePicker endPicker;
    private final TextField durationField;
    private final IntegerField travelField;
    private final Grid<Slot> grid;
    private final Span summary;

    /** Worker names by id, for the free-member column. */
    private final Map<Long, String> workerNames = new HashMap<>();

    AvailabilityView(AvailabilityService availabilityService, CalendarService calendarService,
                     CalendarProperties calendarProperties, Clock clock) {
        this.availabilityService = availabilityService;
        this.organizationId = calendarProperties.organizationId();

        setSizeFull();
        setPadding(false);
        setSpacing(false);

        add(new ViewToolbar("Find a Slot"));

        var content = new VerticalLayout();
        content.setPadding(true);
        content.setSpacing(true);
        content.setSizeFull();

        var options = calendarService.filterOptions(organizationId);
        options.workers().forEach(worker -> workerNames.put(worker.id(), worker.displayName()));

        modeSelect = new RadioButtonGroup<>("Search for");
        modeSelect.setItems(FOR_WORKER, FOR_TEAM);
        modeSelect.setValue(FOR_WORKER);

        workerSelect = new ComboBox<>("Worker");
        workerSelect.setItems(options.workers());
        workerSelect.setItemLabelGenerator(Worker::displayName);
        workerSelect.setClearButtonVisible(true);

        teamSelect = new ComboBox<>("Team");
        teamSelect.setItems(options.teams());
        teamSelect.setItemLabelGenerator(Team::name);
        teamSelect.setClearButtonVisible(true);
        teamSelect.setVisible(false);

        modeSelect.addValueChangeListener(event -> {
            var forTeam = FOR_TEAM.equals(event.getValue());
            workerSelect.setVisible(!forTeam);
            teamSelect.setVisible(forTeam);
        });

        var today = LocalDate.now(clock);
        startPicker = new DatePicker("From", today);
        endPicker = new DatePicker("To", today.plusDays(13));

        durationField = new TextField("Duration");
        durationField.setValue("1h");
        durationField.setHelperText("e.g. 1h 30m or 90m");

        travelField = new IntegerField("Travel (min, each way)");
        travelField.setValue(0);
        travelField.setMin(0);
        travelField.setStepButtonsVisible(true);
        travelField.setStep(15);

        var searchButton = new Button("Find slots", VaadinIcon.SEARCH.create(), event -> search());
        searchButton.addThemeVariants(ButtonVariant.LUMO_PRIMARY);

        var form = new HorizontalLayout(modeSelect, workerSelect, teamSelect, startPicker, endPicker,
                durationField, travelField, searchButton);
        form.setDefaultVerticalComponentAlignment(FlexComponent.Alignment.BASELINE);
        form.setWidthFull();
        form.getStyle().set("flex-wrap", "wrap");
        content.add(form);

        summary = new Span();
        summary.getStyle()
                .set("color", "var(--lumo-secondary-text-color)")
                .set("font-size", "var(--lumo-font-size-s)");
        content.add(summary);

        grid = new Grid<>();
        grid.setSizeFull();
        grid.setSelectionMode(Grid.SelectionMode.NONE);
        grid.addColumn(Slot::displayDate).setHeader("Day").setAutoWidth(true).setFlexGrow(0);
        grid.addColumn(Slot::displayTime).setHeader("Start").setAutoWidth(true).setFlexGrow(0);
        grid.addColumn(slot -> slot.end().toLocalTime().toString()).setHeader("Until").setAutoWidth(true)
                .setFlexGrow(0);
        grid.addColumn(this::freeMembers).setHeader("Free").setFlexGrow(1);
        content.add(grid);
        content.setFlexGrow(1, grid);

        add(content);
    }

    private void search() {
        try {
            var range = DateRange.of(startPicker.getValue(), endPicker.getValue());
            var duration = BookingDuration.parseMinutes(durationField.getValue());
            var travel = travelField.getValue() != null ? travelField.getValue() : 0;

            List<Slot> slots;
            if (FOR_TEAM.equals(modeSelect.getValue())) {
                var team = teamSelect.getValue();
                if (team == null) {
                    throw new CalendarQueryException("Select a team.");
                }
                slots = availabilityService.availabilityForTeam(organizationId, team.id(), range, duration, travel)
                        .slots();
            } else {
                var worker = workerSelect.getValue();
                if (worker == null) {
                    throw new CalendarQueryException("Select a worker.");
                }
                slots = availabilityService.availabilityForWorker(organizationId, worker.id(), range, duration, travel);
            }

            grid.setItems(slots);
            summary.setText(slots.size() + " free slot(s) for " + duration + " min plus 2 x " + travel
                    + " min travel");
        } catch (CalendarQueryException e) {
            log.debug("Rejected slot search: {}", e.getMessage());
            grid.setItems(List.of());
            summary.setText("");
            Notification.show(e.getMessage(), 5000, Notification.Position.MIDDLE)
                    .addThemeVariants(NotificationVariant.LUMO_ERROR);
        }
    }

    private String freeMembers(Slot slot) {
        return slot.freeMembers().stream()
                .map(id -> workerNames.getOrDefault(id, "Worker " + id))
                .collect(Collectors.joining(", "));
    }
}
