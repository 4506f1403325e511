package com.salesagent.leads.search;

import com.salesagent.leads.model.RawRecord;
import com.salesagent.leads.model.SearchRequest;

import java.util.List;

/**
 * An independent source of place records. Output is untrusted and may overlap
 * with other producers; the writer sorts that out.
 */
public interface SearchProducer {

    /** Lower-case tag written into {@link RawRecord#getSourceProvider()}. */
    String sourceTag();

    /**
     * @return records found, possibly empty, never null
     */
    List<RawRecord> search(SearchRequest request);

    default boolean isEnabled() {
        return true;
    }
}
