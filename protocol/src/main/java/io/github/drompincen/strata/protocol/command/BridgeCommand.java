package io.github.drompincen.strata.protocol.command;

/**
 * A message written to the bridge's stdin. Implementations are plain records whose
 * components map one-to-one onto the JSON fields; the {@code type} tag comes from
 * {@link #commandType()}.
 */
public interface BridgeCommand {

    CommandType commandType();
}
