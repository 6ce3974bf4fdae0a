package com.signal.loader;

import com.signal.model.Bar;

import java.io.IOException;
import java.util.List;

/**
 * Source of base-interval bars used to seed history before live ticks arrive.
 */
public interface HistoricalBarLoader {

    /**
     * @return bars ascending by timestamp
     */
    List<Bar> load() throws IOException;

    /**
     * Where the bars come from, for log messages.
     */
    String describe();
}
