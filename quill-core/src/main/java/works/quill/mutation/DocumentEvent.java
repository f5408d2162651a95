package works.quill.mutation;

import java.time.Instant;

/**
 * A record that <code>mutation</code> produced revision <code>revision</code>.
 */
public record DocumentEvent(
	long revision,
	Instant timestamp,
	Mutation mutation
) { }
