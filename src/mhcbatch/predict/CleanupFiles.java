package mhcbatch.predict;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

/*
 * Deletes the files and directories of one prediction run when the run is over, whether it ended
 * normally or with an exception. Close it in a finally block.
 *
 * close() runs once; later calls do nothing. Open handles are closed before anything is deleted.
 * Failures are logged and swallowed so that they never hide the error that ended the run.
 */
public class CleanupFiles implements Closeable {

	private static Logger logger = PredictionLogger.getLogger();

	private final List<Closeable> handles = new ArrayList<Closeable>();
	private final List<File> files = new ArrayList<File>();
	private final List<File> directories = new ArrayList<File>();
	private boolean closed = false;

	public CleanupFiles(){}

	public CleanupFiles( Collection<File> files, Collection<File> directories, Collection<? extends Closeable> handles ){
		if( files != null ){
			this.files.addAll( files );
		}

		if( directories != null ){
			this.directories.addAll( directories );
		}

		if( handles != null ){
			this.handles.addAll( handles );
		}
	}

	public synchronized File addFile( File file ){
		files.add( file );
		return file;
	}

	public synchronized File addDirectory( File directory ){
		directories.add( directory );
		return directory;
	}

	public synchronized void addHandle( Closeable handle ){
		handles.add( handle );
	}

	public synchronized List<File> getFiles(){
		return new ArrayList<File>( files );
	}

	public synchronized List<File> getDirectories(){
		return new ArrayList<File>( directories );
	}

	public synchronized boolean isClosed(){
		return closed;
	}

	public synchronized void close(){

		if( closed ){
			return;
		}

		closed = true;

		for( Closeable handle : handles ){
			try {
				handle.close();

			} catch( IOException e ){
				logger.warn( "Unable to close " + handle + ": " + e.getMessage());

			} catch( RuntimeException e ){
				logger.warn( "Unable to close " + handle + ": " + e.getMessage());
			}
		}

		for( File file : files ){
			logger.debug( "Cleaning up " + file );
			try {
				if( file.exists()){
					FileUtils.forceDelete( file );
				}

			} catch( IOException e ){
				logger.warn( "Unable to delete " + file + ": " + e.getMessage());

			} catch( RuntimeException e ){
				logger.warn( "Unable to delete " + file + ": " + e.getMessage());
			}
		}

		for( File directory : directories ){
			logger.debug( "Removing directory " + directory );
			try {
				if( directory.exists()){
					FileUtils.deleteDirectory( directory );
				}

			} catch( IOException e ){
				logger.warn( "Unable to remove directory " + directory + ": " + e.getMessage());

			} catch( RuntimeException e ){
				logger.warn( "Unable to remove directory " + directory + ": " + e.getMessage());
			}
		}
	}
}
