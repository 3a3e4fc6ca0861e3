package com.acme.brewbucks.command;

/** Marker for requests that operate on a domain aggregate. */
public interface DomainCommand {}
