package com.vidnyan.linthub.application.port.out;

import com.vidnyan.linthub.domain.rule.Overrides;

/**
 * Port supplying the process-wide override table. Built once, read concurrently.
 */
public interface OverrideCatalog {

    Overrides get();
}
