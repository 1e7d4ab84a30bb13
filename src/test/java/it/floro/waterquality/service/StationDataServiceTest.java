package it.floro.waterquality.service;

import it.floro.waterquality.config.SimulationProperties;
import it.floro.waterquality.domain.StationSample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StationDataServiceTest {

    private static final int STATIONS = 5;

    private StationDataService dataService;

    @BeforeEach
    void setUp() {
        SimulationProperties properties = new SimulationProperties();
        properties.setSeed(11);
        properties.setStations(STATIONS);
        properties.setHistoryYears(0);
        dataService = new StationDataService(properties);
    }

    @Test
    void testDateBounds() {
        assertEquals(LocalDate.now(), dataService.getMaxDate());
        assertEquals(LocalDate.now().withDayOfYear(1), dataService.getMinDate());
    }

    @Test
    void testHistoricalDatasetIsCached() {
        List<StationSample> all = dataService.getAll();
        long days = ChronoUnit.DAYS.between(dataService.getMinDate(), dataService.getMaxDate()) + 1;

        assertEquals(days * STATIONS, all.size());
        assertSame(all, dataService.getAll());
        assertThrows(UnsupportedOperationException.class, () -> all.add(all.get(0)));
    }

    @Test
    void testLatestByStation() {
        List<StationSample> latest = dataService.latestByStation();

        assertEquals(STATIONS, latest.size());
        assertEquals(List.of("MH-001", "MH-002", "MH-003", "MH-004", "MH-005"),
                latest.stream().map(StationSample::stationId).toList());
        assertTrue(latest.stream().allMatch(s -> s.date().equals(dataService.getMaxDate())));
    }

    @Test
    void testLiveUpdateReplacesTodaysSamples() {
        List<StationSample> before = dataService.getAll();
        dataService.updateLiveData();
        List<StationSample> after = dataService.getAll();

        assertEquals(before.size(), after.size());
        LocalDate today = LocalDate.now();
        List<StationSample> todays = after.stream().filter(s -> s.date().equals(today)).toList();
        assertEquals(STATIONS, todays.size());

        // Lo storico resta invariato
        assertEquals(
                before.stream().filter(s -> !s.date().equals(today)).toList(),
                after.stream().filter(s -> !s.date().equals(today)).toList());
        // Stesse stazioni anche nei campioni live
        assertEquals(
                before.stream().filter(s -> s.date().equals(today)).map(StationSample::stationName).toList(),
                todays.stream().map(StationSample::stationName).toList());
    }

    @Test
    void testLiveUpdateBeforeLoadIsNoOp() {
        dataService.updateLiveData();
        dataService.regenerate();
        List<StationSample> first = dataService.getAll();
        dataService.regenerate();
        assertEquals(first, dataService.getAll());
    }

    @Test
    void testLiveUpdateOnNewDayAdvancesMaxDate() {
        SimulationProperties properties = new SimulationProperties();
        properties.setSeed(11);
        properties.setStations(STATIONS);
        properties.setHistoryYears(0);
        SettableClock clock = new SettableClock(Instant.parse("2024-03-10T23:59:00Z"));
        StationDataService service = new StationDataService(properties, clock);

        int before = service.getAll().size();
        assertEquals(LocalDate.of(2024, 3, 10), service.getMaxDate());

        clock.instant = Instant.parse("2024-03-11T00:01:00Z");
        service.updateLiveData();

        LocalDate newDay = LocalDate.of(2024, 3, 11);
        assertEquals(newDay, service.getMaxDate());
        assertEquals(before + STATIONS, service.getAll().size());
        assertEquals(STATIONS, service.getAll().stream().filter(s -> s.date().equals(newDay)).count());
        assertTrue(service.latestByStation().stream().allMatch(s -> s.date().equals(newDay)));
    }

    /** Orologio UTC spostabile a mano. */
    private static final class SettableClock extends Clock {

        private Instant instant;

        SettableClock(Instant instant) {
            this.instant = instant;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
