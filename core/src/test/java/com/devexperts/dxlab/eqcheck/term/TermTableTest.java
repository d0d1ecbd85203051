package com.devexperts.dxlab.eqcheck.term;

/*
 * #%L
 * core
 * %%
 * Copyright (C) 2015 - 2018 Devexperts, LLC
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 * 
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * #L%
 */

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.devexperts.dxlab.eqcheck.term.Terms.*;
import static org.junit.Assert.*;

public class TermTableTest {
    @Test
    public void testIntern() {
        TermTable table = new TermTable();
        Term t1 = choice(prefix("a", stop()), prefix("b", stop()));
        Term t2 = choice(prefix("a", stop()), prefix("b", stop()));
        assertNotSame(t1, t2);
        assertSame(t1, table.intern(t1));
        assertSame(t1, table.intern(t2));
        assertTrue(table.contains(t2));
        assertFalse(table.contains(stop()));
        assertEquals(1, table.size());
    }

    @Test
    public void testConcurrentIntern() throws Exception {
        TermTable table = new TermTable();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Term>> futures = new ArrayList<>();
            for (int i = 0; i < 100; i++)
                futures.add(executor.submit(() -> table.intern(rec("X", prefix("a", var("X"))))));
            Term first = futures.get(0).get();
            for (Future<Term> f : futures)
                assertSame(first, f.get());
            assertEquals(1, table.size());
        } finally {
            executor.shutdown();
        }
    }
}
