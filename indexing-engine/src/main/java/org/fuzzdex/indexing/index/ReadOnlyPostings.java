package org.fuzzdex.indexing.index;

import org.fuzzdex.core.model.Posting;

import java.util.Collection;
import java.util.Set;

/**
 * Read-only view over an inverted index. The view follows later writes to the wrapped index
 * but cannot be cast back to a writable one.
 */
public final class ReadOnlyPostings implements PostingsReader {
	private final PostingsReader delegate;

	public ReadOnlyPostings(PostingsReader delegate) {
		this.delegate = delegate;
	}

	@Override
	public Collection<Posting> postings(String token) {
		return delegate.postings(token);
	}

	@Override
	public Set<String> tokensOf(int internalId) {
		return delegate.tokensOf(internalId);
	}

	@Override
	public boolean containsToken(String token) {
		return delegate.containsToken(token);
	}

	@Override
	public int tokenCount() {
		return delegate.tokenCount();
	}

	@Override
	public int postingCount() {
		return delegate.postingCount();
	}
}
