package com.gentoro.medigraph.sync.plan;

/** One step of an {@link UpsertPlan}. */
public interface PlanOperation {}
