package edu.isi.wdfa;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.util.Date;
// stderr reporting for the library and the counting tool
public class Debug {

	static String encoding = "utf-8";
	private static OutputStreamWriter w=null;
	// timing lines at or below this level are printed; 0 prints none
	private static int dblevel=0;

	public static void setEncoding(String s) {
		encoding = s;
		w = null;
	}
	public static void setDbLevel(int i) {
		dblevel = i;
	}

	// messages meant for the user, always printed
	public static void prettyDebug(String s) {
		write(s);
	}
	// printed only when d is set; prefixed with the calling class and method
	public static void debug(boolean d, String s)  {
		if (!d)
			return;
		StackTraceElement caller = new Throwable().getStackTrace()[1];
		write(caller.getClassName()+":"+caller.getMethodName()+" : "+s);
	}
	// time since start, if the level set by setDbLevel reaches needlevel
	public static void dbtime(int needlevel, Date start, String msg) {
		if (dblevel < needlevel)
			return;
		write(msg+": "+(new Date().getTime() - start.getTime())+" ms");
	}

	private static void write(String s) {
		if (w == null) {
			try {
				w = new OutputStreamWriter(System.err, encoding);
			}
			catch (UnsupportedEncodingException e) {
				System.err.println("Warning: encoding "+encoding+" not supported; using default");
				w = new OutputStreamWriter(System.err);
			}
		}
		try {
			w.write(s+"\n");
			w.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+s);
		}
	}
}
