package com.kotsin.advisor.autogen;

import com.kotsin.advisor.config.SignalProps;
import com.kotsin.advisor.model.Instrument;
import com.kotsin.advisor.model.SignalCategory;
import com.kotsin.advisor.model.VenueKind;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Instruments scanned on each generation run.
 */
@Component
public class InstrumentUniverse {

    private final SignalProps.Universe universe;
    private final int fastSampleSize;
    private final Random random;

    @Autowired
    public InstrumentUniverse(SignalProps props) {
        this(props, new Random());
    }

    InstrumentUniverse(SignalProps props, Random random) {
        this.universe = props.universe();
        this.fastSampleSize = props.autogen().fastSampleSize();
        this.random = random;
    }

    public List<Instrument> instruments(SignalCategory category, VenueKind venue) {
        if (category == SignalCategory.FLOW) {
            // flow data only exists for the configured crypto majors
            return toInstruments(universe.flow(), VenueKind.CRYPTO);
        }
        List<Instrument> all = toInstruments(venue == VenueKind.FOREX ? universe.forex() : universe.crypto(), venue);
        if (category == SignalCategory.FAST && all.size() > fastSampleSize) {
            List<Instrument> shuffled = new ArrayList<>(all);
            Collections.shuffle(shuffled, random);
            return List.copyOf(shuffled.subList(0, fastSampleSize));
        }
        return all;
    }

    private static List<Instrument> toInstruments(List<String> pairs, VenueKind venue) {
        List<Instrument> result = new ArrayList<>(pairs.size());
        for (String pair : pairs) {
            result.add(new Instrument(pair, venue));
        }
        return result;
    }
}
