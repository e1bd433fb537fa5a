package com.joshlong.portal.search;

import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * a transaction manager without a database behind it. Synchronizations work as usual,
 * which is what {@link InMemorySearchIndexQueue} relies on.
 */
class FakeTransactionManager extends AbstractPlatformTransactionManager {

	final List<TransactionDefinition> begun = new ArrayList<>();

	int commits;

	int rollbacks;

	boolean failNextCommit;

	@Override
	protected Object doGetTransaction() {
		return new Object();
	}

	@Override
	protected void doBegin(Object transaction, TransactionDefinition definition) {
		this.begun.add(definition);
	}

	@Override
	protected void doCommit(DefaultTransactionStatus status) {
		if (this.failNextCommit) {
			this.failNextCommit = false;
			throw new TransactionSystemException("could not serialize access due to concurrent update");
		}
		this.commits += 1;
	}

	@Override
	protected void doRollback(DefaultTransactionStatus status) {
		this.rollbacks += 1;
	}

}
