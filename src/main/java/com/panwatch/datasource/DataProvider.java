package com.panwatch.datasource;

import com.panwatch.domain.enums.DataSourceType;
import com.panwatch.domain.model.DataSourceBinding;
import java.util.List;
import java.util.Set;

/**
 * A market-data provider implementation, registered as a Spring bean.
 *
 * <p>A {@link DataSourceBinding} selects an implementation by {@link #providerId()}; the
 * binding's config map carries provider-specific settings (api keys, endpoints). Failures are
 * signalled by throwing; the router records the message and moves on to the next binding.
 */
public interface DataProvider {

    String providerId();

    Set<DataSourceType> supportedTypes();

    List<DataItem> fetch(DataSourceType type, FetchRequest request, DataSourceBinding binding);
}
