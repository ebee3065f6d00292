package mhcbatch.predict;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class CleanupFilesTest {

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	@Test
	public void removesFilesAndDirectories() throws Exception {
		File a = tmp.newFile( "a.txt" );
		File dir = tmp.newFolder( "tmp_0_0_netMHCpan" );
		File nested = new File( dir, "nested" );
		assertTrue( nested.mkdir());
		assertTrue( new File( nested, "b.txt" ).createNewFile());

		CleanupFiles cleanup = new CleanupFiles( Arrays.asList( a ), Arrays.asList( dir ), null );
		cleanup.close();

		assertFalse( a.exists());
		assertFalse( dir.exists());
		assertTrue( cleanup.isClosed());
	}

	@Test
	public void cleansUpWhenTheScopeThrows() throws Exception {
		CleanupFiles cleanup = new CleanupFiles();
		File input = null, output = null;

		try {
			try {
				input = cleanup.addFile( tmp.newFile( "input_file_0_.fa" ));
				output = cleanup.addFile( tmp.newFile( "netMHCpan_output_0_0_9" ));
				throw new IllegalStateException( "parse failed" );

			} finally {
				cleanup.close();
			}

		} catch( IllegalStateException e ){
			assertEquals( "parse failed", e.getMessage());
		}

		assertFalse( input.exists());
		assertFalse( output.exists());
	}

	@Test
	public void closesHandlesBeforeDeleting() throws Exception {
		final File file = tmp.newFile( "held.txt" );
		final List<Boolean> existedAtClose = new ArrayList<Boolean>();

		CleanupFiles cleanup = new CleanupFiles( Arrays.asList( file ), null, null );
		cleanup.addHandle( new Closeable(){
			public void close(){
				existedAtClose.add( file.exists());
			}
		});

		cleanup.close();
		assertEquals( Arrays.asList( Boolean.TRUE ), existedAtClose );
		assertFalse( file.exists());
	}

	@Test
	public void runsOnlyOnce() throws Exception {
		final int[] closes = new int[1];
		CleanupFiles cleanup = new CleanupFiles();
		cleanup.addHandle( new Closeable(){
			public void close(){
				closes[0]++;
			}
		});

		cleanup.close();
		cleanup.close();
		assertEquals( 1, closes[0] );
	}

	@Test
	public void failuresAreSwallowed() throws Exception {
		File kept = tmp.newFile( "kept.txt" );
		CleanupFiles cleanup = new CleanupFiles( Arrays.asList( new File( tmp.getRoot(), "never-created" ), kept ), null, null );
		cleanup.addHandle( new Closeable(){
			public void close() throws IOException {
				throw new IOException( "already closed" );
			}
		});

		try {
			cleanup.close();

		} catch( RuntimeException e ){
			fail( "cleanup must not throw: " + e );
		}

		assertFalse( kept.exists());
	}

	@Test
	public void aBadDirectoryDoesNotStopTheRest() throws Exception {
		File notADirectory = tmp.newFile( "tmp_0_0_netMHCpan" );
		File dir = tmp.newFolder( "tmp_0_1_netMHCpan" );
		assertTrue( new File( dir, "scratch.txt" ).createNewFile());

		CleanupFiles cleanup = new CleanupFiles( null, Arrays.asList( notADirectory ), null );
		cleanup.addDirectory( dir );

		try {
			cleanup.close();

		} catch( RuntimeException e ){
			fail( "cleanup must not throw: " + e );
		}

		assertFalse( dir.exists());
		assertTrue( cleanup.isClosed());
	}
}
