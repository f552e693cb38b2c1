package com.vidnyan.linthub.application.port.out;

import com.vidnyan.linthub.domain.rule.Tweaks;

/**
 * Port supplying the process-wide tweak table. Built once, read concurrently.
 */
public interface TweakCatalog {

    Tweaks get();
}
