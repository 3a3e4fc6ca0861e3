package com.acme.brewbucks.command;

/**
 * Executes one kind of command.
 *
 * @param <C> the command type
 * @param <R> the result type
 */
@FunctionalInterface
public interface CommandHandler<C extends DomainCommand, R> {
  R handle(C command);
}
