package com.sportsdata.application.federation;

import com.sportsdata.domain.ports.ProviderException;
import com.sportsdata.domain.ports.SportsDataProvider;

/**
 * One provider operation with its arguments already bound.
 */
@FunctionalInterface
public interface ProviderCall<T> {

    T apply(SportsDataProvider provider) throws ProviderException;
}
